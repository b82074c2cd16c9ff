package com.semantic.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 调度中心配置项：Key 轮转间隔、冷却与重试延迟。
 */
@Data
@ConfigurationProperties(prefix = "semantic.dispatcher")
public class DispatcherProperties {

    /** 自动轮转时同一 Key 两次使用的最小间隔（经验值，近似常见的单 Key 每分钟配额） */
    private Duration minKeySpacing = Duration.ofSeconds(60);

    /** 限流错误未给出建议延迟时的默认冷却时间 */
    private Duration defaultRateLimitDelay = Duration.ofSeconds(60);

    /** 在供应商建议的重试延迟上追加的缓冲时间 */
    private Duration rateLimitBuffer = Duration.ofSeconds(5);

    /** 临时性错误（网络、超时、响应格式异常）后的固定等待时间 */
    private Duration transientDelay = Duration.ofSeconds(5);

    /** 无可用客户端时的等待时间 */
    private Duration noClientDelay = Duration.ofSeconds(10);

    /** 默认最大尝试次数，供应商未单独配置且类型无默认值时使用 */
    private int maxAttempts = 3;

    /** 等待调度线程数 */
    private int waiterThreads = 2;

    /** Key 状态日志的输出间隔（秒） */
    private int statusReportIntervalSeconds = 60;
}
