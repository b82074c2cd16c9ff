package com.semantic.dispatcher.retry;

import com.semantic.common.dto.EvaluationOutcome;

/**
 * 使用指定 Key 发起的一次供应商调用。
 * <p>
 * 成功时返回归一化后的结果；失败时抛出
 * {@link com.semantic.common.exception.AiServiceException} 的子类，由 {@link RetryOrchestrator} 分类处理。
 */
@FunctionalInterface
public interface KeyedCall {

    EvaluationOutcome invoke(String apiKey, int attempt);
}
