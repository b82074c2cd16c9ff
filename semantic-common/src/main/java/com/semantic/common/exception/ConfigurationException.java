package com.semantic.common.exception;

/**
 * 供应商配置错误（无可用 Key、无法构建客户端、Base URL 非法等）。
 */
public class ConfigurationException extends AiServiceException {

    public ConfigurationException(String message) {
        super("CONFIG_ERROR", message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIG_ERROR", message, cause);
    }
}
