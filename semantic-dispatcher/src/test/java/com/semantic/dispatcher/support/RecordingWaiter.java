package com.semantic.dispatcher.support;

import com.semantic.dispatcher.wait.Waiter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 不真正阻塞的等待：记录每次等待时长，可选地把时钟推进相同时长。
 */
public class RecordingWaiter implements Waiter {

    private final MutableClock clock;
    private final List<Duration> waits = Collections.synchronizedList(new ArrayList<>());

    public RecordingWaiter() {
        this(null);
    }

    public RecordingWaiter(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void await(Duration delay, String reason) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        waits.add(delay);
        if (clock != null) {
            clock.advance(delay);
        }
    }

    @Override
    public int cancelAll() {
        return 0;
    }

    public List<Duration> getWaits() {
        synchronized (waits) {
            return List.copyOf(waits);
        }
    }
}
