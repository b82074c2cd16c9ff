package com.semantic.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class SemanticException extends RuntimeException {

    private final String errorCode;

    public SemanticException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SemanticException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
