package com.semantic.common.exception;

/**
 * 等待或流式读取被外部取消。
 */
public class OperationCancelledException extends SemanticException {

    public OperationCancelledException(String message) {
        super("CANCELLED", message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super("CANCELLED", message, cause);
    }
}
