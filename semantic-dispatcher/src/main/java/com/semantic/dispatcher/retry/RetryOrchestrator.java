package com.semantic.dispatcher.retry;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.exception.AuthenticationException;
import com.semantic.common.exception.ConfigurationException;
import com.semantic.common.exception.KeyPoolExhaustedException;
import com.semantic.common.exception.OperationCancelledException;
import com.semantic.common.exception.RateLimitException;
import com.semantic.common.util.TextUtils;
import com.semantic.dispatcher.config.DispatcherProperties;
import com.semantic.dispatcher.pool.ApiKeyPool;
import com.semantic.dispatcher.wait.Waiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 带 Key 轮转的有界重试。
 * <p>
 * 每次尝试：按策略轮转取 Key → 调用供应商 → 按异常类型处理：
 * <ul>
 *   <li>认证/配置错误：立即返回错误，不重试</li>
 *   <li>限流：冷却本次使用的 Key（建议延迟 + 缓冲，或默认冷却时间），强制轮转后继续</li>
 *   <li>其他错误：等待固定延迟，强制轮转后继续</li>
 *   <li>池为空：等待后重试，耗尽后返回"无可用客户端"</li>
 * </ul>
 * 不论哪条路径，返回值都是 {@link EvaluationOutcome}，不向外抛异常。
 */
@Slf4j
@RequiredArgsConstructor
public class RetryOrchestrator {

    private final DispatcherProperties properties;
    private final Waiter waiter;

    public RetryPolicy policyFor(int maxAttempts) {
        return RetryPolicy.of(properties, maxAttempts);
    }

    public EvaluationOutcome execute(String providerName, ApiKeyPool pool, RetryPolicy policy, KeyedCall call) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        String lastReason = "未知错误";
        boolean alreadyRotated = false;

        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                boolean lastAttempt = attempt == maxAttempts;

                String apiKey;
                try {
                    apiKey = alreadyRotated ? pool.currentKey() : pool.rotate(false);
                } catch (KeyPoolExhaustedException e) {
                    log.warn("[{}] 无可用客户端 (尝试 {}/{}): {}", providerName, attempt, maxAttempts, e.getMessage());
                    lastReason = "无可用客户端";
                    if (lastAttempt) {
                        return EvaluationOutcome.error("无可用客户端: " + providerName);
                    }
                    waiter.await(policy.getNoClientDelay(), providerName + " 无可用客户端");
                    continue;
                }
                alreadyRotated = false;

                log.info("正在调用 {} 进行语义比对 (尝试 {}/{}, Key {})",
                        providerName, attempt, maxAttempts, TextUtils.maskKey(apiKey));
                try {
                    return call.invoke(apiKey, attempt);

                } catch (AuthenticationException | ConfigurationException e) {
                    log.error("[{}] {}，不再重试", providerName, e.getMessage());
                    return EvaluationOutcome.error(e.getMessage());

                } catch (RateLimitException e) {
                    lastReason = e.getMessage();
                    Duration cooldown = e.getRetryAfter()
                            .map(d -> d.plus(policy.getRateLimitBuffer()))
                            .orElse(policy.getDefaultRateLimitDelay());
                    log.warn("[{}] 速率限制 (尝试 {}/{}): {}", providerName, attempt, maxAttempts, e.getMessage());
                    pool.coolDown(apiKey, cooldown);
                    if (!lastAttempt) {
                        log.info("[{}] 检测到限流，立即强制轮转到下一个密钥", providerName);
                        pool.rotate(true);
                        alreadyRotated = true;
                    }

                } catch (OperationCancelledException e) {
                    throw e;

                } catch (RuntimeException e) {
                    lastReason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.warn("[{}] 调用失败 (尝试 {}/{}): {}", providerName, attempt, maxAttempts, lastReason);
                    if (!lastAttempt) {
                        waiter.await(policy.getTransientDelay(), providerName + " 调用失败后重试");
                        pool.rotate(true);
                        alreadyRotated = true;
                    }
                }
            }
        } catch (OperationCancelledException e) {
            log.info("[{}] 语义比对已取消: {}", providerName, e.getMessage());
            return EvaluationOutcome.error("已取消: " + e.getMessage());
        }

        log.error("[{}] 语义比对在 {} 次尝试后仍然失败: {}", providerName, maxAttempts, lastReason);
        return EvaluationOutcome.error("重试次数耗尽: " + lastReason);
    }
}
