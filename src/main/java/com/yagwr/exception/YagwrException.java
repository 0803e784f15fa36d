package com.yagwr.exception;

/**
 * Base exception for the webhook runner.
 */
public class YagwrException extends RuntimeException {

    public YagwrException(String message) {
        super(message);
    }

    public YagwrException(String message, Throwable cause) {
        super(message, cause);
    }
}
