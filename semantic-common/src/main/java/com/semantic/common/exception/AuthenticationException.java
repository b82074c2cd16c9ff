package com.semantic.common.exception;

/**
 * 认证失败（Key 无效、被吊销、无权限）。立即返回错误，不重试。
 */
public class AuthenticationException extends AiServiceException {

    public AuthenticationException(String message) {
        super("AUTH_ERROR", message, null);
    }
}
