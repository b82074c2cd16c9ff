package com.semantic.dispatcher.wait;

import java.time.Duration;

/**
 * 等待指示观察者（终端转圈、进度条等）。仅用于展示，不参与正确性。
 */
public interface WaitObserver {

    void onWaitStarted(String reason, Duration delay);

    void onWaitFinished(String reason, boolean cancelled);
}
