package com.semantic.dispatcher.wait;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 以日志形式输出等待指示。
 */
@Slf4j
public class LoggingWaitObserver implements WaitObserver {

    @Override
    public void onWaitStarted(String reason, Duration delay) {
        log.info("⏳ {}，等待 {} 秒", reason, String.format("%.1f", delay.toMillis() / 1000.0));
    }

    @Override
    public void onWaitFinished(String reason, boolean cancelled) {
        if (cancelled) {
            log.info("等待已取消: {}", reason);
        } else {
            log.debug("等待结束: {}", reason);
        }
    }
}
