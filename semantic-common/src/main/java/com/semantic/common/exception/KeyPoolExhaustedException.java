package com.semantic.common.exception;

/**
 * Key 池为空，无法获取可用客户端时抛出。
 */
public class KeyPoolExhaustedException extends SemanticException {

    public KeyPoolExhaustedException(String message) {
        super("KEY_EXHAUSTED", message);
    }
}
