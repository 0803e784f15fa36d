package com.yagwr.exception;

/**
 * Exception thrown when a webhook request cannot be handed to the dispatch worker.
 * Typically because the worker is not running yet or is shutting down.
 */
public class RequestRejectedException extends YagwrException {

    public RequestRejectedException(String message) {
        super(message);
    }

    public RequestRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
