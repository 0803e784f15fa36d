package com.yagwr.exception;

/**
 * Thrown when a condition description cannot be parsed into a condition tree.
 */
public class InvalidExpressionException extends YagwrException {

    public InvalidExpressionException(String message) {
        super(message);
    }

    public InvalidExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
