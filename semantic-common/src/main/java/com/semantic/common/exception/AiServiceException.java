package com.semantic.common.exception;

/**
 * AI 服务调用异常的父类。
 * <p>
 * 供应商内部抛出的异常都应归入以下子类之一，由重试调度器据此决定是否重试、是否轮转 Key：
 * <ul>
 *   <li>{@link ConfigurationException}：配置错误，不重试</li>
 *   <li>{@link AuthenticationException}：认证失败，不重试</li>
 *   <li>{@link RateLimitException}：速率限制，冷却当前 Key 并强制轮转后重试</li>
 *   <li>{@link TransientException}：网络/超时/响应体异常，固定延迟后重试</li>
 * </ul>
 */
public class AiServiceException extends SemanticException {

    public AiServiceException(String message) {
        super("AI_ERROR", message);
    }

    public AiServiceException(String message, Throwable cause) {
        super("AI_ERROR", message, cause);
    }

    protected AiServiceException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
