package com.semantic.dispatcher.wait;

import java.time.Duration;

/**
 * 可取消的阻塞等待。
 * <p>
 * 等待期间调用方线程阻塞，但等待本身由定时器唤醒，
 * 任何线程都可以通过 {@link #cancelAll()} 让所有正在进行的等待立即结束。
 */
public interface Waiter {

    /**
     * 阻塞等待指定时长。时长为空、为零或为负时立即返回。
     *
     * @param delay  等待时长
     * @param reason 等待原因，用于日志与等待指示
     * @throws com.semantic.common.exception.OperationCancelledException 等待被取消或线程被中断
     */
    void await(Duration delay, String reason);

    /**
     * 取消所有正在进行的等待。
     *
     * @return 被取消的等待数量
     */
    int cancelAll();
}
