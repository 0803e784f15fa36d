package com.yagwr.core;

/**
 * Thread-safe entry point into the dispatch worker's queue.
 */
@FunctionalInterface
public interface RequestSink {

    /**
     * Queue a request without blocking.
     *
     * @param request the request to dispatch
     * @throws com.yagwr.exception.RequestRejectedException if the worker no longer accepts requests
     */
    void submit(WebhookRequest request);
}
