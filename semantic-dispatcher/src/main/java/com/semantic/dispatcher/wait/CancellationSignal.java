package com.semantic.dispatcher.wait;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 流式读取的停止信号。
 * <p>
 * 每次读取开始时领取一个 {@link Token}；此后任意线程调用 {@link #cancel()}，
 * 之前领取的令牌都会变为已停止状态，之后领取的新令牌不受影响。
 */
public class CancellationSignal {

    private final AtomicLong generation = new AtomicLong();

    public Token newToken() {
        return new Token(generation.get());
    }

    public void cancel() {
        generation.incrementAndGet();
    }

    public final class Token {

        private final long issuedAt;

        private Token(long issuedAt) {
            this.issuedAt = issuedAt;
        }

        public boolean isCancelled() {
            return generation.get() != issuedAt;
        }
    }
}
