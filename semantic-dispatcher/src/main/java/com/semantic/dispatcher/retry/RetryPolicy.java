package com.semantic.dispatcher.retry;

import com.semantic.dispatcher.config.DispatcherProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 单个供应商的重试参数。
 */
@Value
@Builder
public class RetryPolicy {

    int maxAttempts;

    /** 限流错误未给出建议延迟时的冷却时间 */
    Duration defaultRateLimitDelay;

    /** 追加在建议延迟上的缓冲 */
    Duration rateLimitBuffer;

    Duration transientDelay;

    Duration noClientDelay;

    public static RetryPolicy of(DispatcherProperties properties, int maxAttempts) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts > 0 ? maxAttempts : properties.getMaxAttempts())
                .defaultRateLimitDelay(properties.getDefaultRateLimitDelay())
                .rateLimitBuffer(properties.getRateLimitBuffer())
                .transientDelay(properties.getTransientDelay())
                .noClientDelay(properties.getNoClientDelay())
                .build();
    }
}
