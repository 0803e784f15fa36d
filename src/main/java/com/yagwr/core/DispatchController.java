package com.yagwr.core;

import com.yagwr.exception.RequestRejectedException;
import com.yagwr.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * State shared between the HTTP acceptor threads and the dispatch worker.
 * <p>
 * The worker publishes its {@link RequestSink} exactly once while booting; acceptor
 * threads only read it. The latch makes the publication visible across threads.
 */
public class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final List<Rule> rules;
    private final CountDownLatch ready = new CountDownLatch(1);
    private volatile RequestSink sink;

    public DispatchController(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Publish the worker's sink. Only the first call has an effect.
     */
    public synchronized void publish(RequestSink sink) {
        if (this.sink != null) {
            log.warn("Request sink already published, ignoring");
            return;
        }
        this.sink = sink;
        ready.countDown();
        log.debug("Request sink published");
    }

    public boolean isReady() {
        return ready.getCount() == 0;
    }

    /**
     * Block until the worker has published its sink.
     *
     * @return true if ready, false if the timeout elapsed
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Hand a request to the worker. Never throws: failures are logged and the request is dropped.
     *
     * @return true if the request was queued
     */
    public boolean handOff(WebhookRequest request) {
        RequestSink target = sink;
        if (target == null) {
            log.error("Dispatch worker not ready, dropping request from {}", request.clientAddress());
            return false;
        }
        try {
            target.submit(request);
            log.debug("Request from {} queued for dispatch", request.clientAddress());
            return true;
        } catch (RequestRejectedException e) {
            log.error("Unable to queue request from {}: {}", request.clientAddress(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unable to queue request from {}", request.clientAddress(), e);
        }
        return false;
    }
}
