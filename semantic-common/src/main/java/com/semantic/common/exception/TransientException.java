package com.semantic.common.exception;

/**
 * 临时性错误（网络异常、超时、5xx、响应体格式异常），固定延迟后重试。
 */
public class TransientException extends AiServiceException {

    public TransientException(String message) {
        super("TRANSIENT_ERROR", message, null);
    }

    public TransientException(String message, Throwable cause) {
        super("TRANSIENT_ERROR", message, cause);
    }
}
