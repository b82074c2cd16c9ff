package com.semantic.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 速率限制（HTTP 429、RESOURCE_EXHAUSTED、响应体内嵌的限流业务码）。
 * <p>
 * {@code retryAfter} 为供应商建议的重试延迟，无法解析时为空，由调度器使用默认冷却时间。
 */
public class RateLimitException extends AiServiceException {

    private final Duration retryAfter;

    public RateLimitException(String message) {
        this(message, null);
    }

    public RateLimitException(String message, Duration retryAfter) {
        super("RATE_LIMITED", message, null);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
