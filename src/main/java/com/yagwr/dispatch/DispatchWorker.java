package com.yagwr.dispatch;

import com.yagwr.action.ActionExecutor;
import com.yagwr.core.DispatchController;
import com.yagwr.core.RequestSink;
import com.yagwr.core.WebhookRequest;
import com.yagwr.exception.RequestRejectedException;
import com.yagwr.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads webhook requests from an unbounded FIFO queue and runs the actions of every
 * matching rule, one request at a time.
 * <p>
 * Acceptor threads enqueue through {@link #submit(WebhookRequest)}. Cancellation is queued
 * at the head of the same deque so it overtakes pending requests and wakes the worker.
 * An action already running is always awaited; processes are never killed.
 */
public class DispatchWorker implements WorkerTask, RequestSink {

    private static final Logger log = LoggerFactory.getLogger(DispatchWorker.class);

    private record Signal(WebhookRequest request) {}

    private static final Signal CANCEL = new Signal(null);

    private final DispatchController controller;
    private final ActionExecutor actionExecutor;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.BOOTING);
    private final AtomicLong processedCount = new AtomicLong();

    private volatile LinkedBlockingDeque<Signal> queue;
    private volatile boolean cancelRequested;

    public DispatchWorker(DispatchController controller, ActionExecutor actionExecutor) {
        this.controller = controller;
        this.actionExecutor = actionExecutor;
    }

    @Override
    public void run() throws InterruptedException {
        log.debug("Starting request worker");
        LinkedBlockingDeque<Signal> requests = new LinkedBlockingDeque<>();
        synchronized (this) {
            queue = requests;
            if (cancelRequested) {
                requests.offerFirst(CANCEL);
            }
            state.set(WorkerState.RUNNING);
        }
        controller.publish(this);
        log.info("Request worker running with {} rules", controller.getRules().size());

        try {
            while (true) {
                Signal signal = requests.takeFirst();
                if (signal == CANCEL) {
                    log.debug("Cancellation received");
                    break;
                }
                dispatch(signal.request());
                processedCount.incrementAndGet();
            }
        } finally {
            // submit() offers under the same lock, so nothing is appended once DRAINING is visible
            synchronized (this) {
                state.set(WorkerState.DRAINING);
            }
            drain(requests);
            state.set(WorkerState.STOPPED);
            log.info("Request worker stopped after {} requests", processedCount.get());
        }
    }

    @Override
    public synchronized void submit(WebhookRequest request) {
        WorkerState current = state.get();
        if (current == WorkerState.BOOTING) {
            throw new RequestRejectedException("Dispatch worker is still booting");
        }
        if (cancelRequested || current != WorkerState.RUNNING) {
            throw new RequestRejectedException("Dispatch worker is shutting down");
        }
        queue.offerLast(new Signal(request));
    }

    @Override
    public void cancel() {
        synchronized (this) {
            cancelRequested = true;
            if (queue != null) {
                queue.offerFirst(CANCEL);
            }
        }
        log.debug("Cancellation requested");
    }

    private void dispatch(WebhookRequest request) throws InterruptedException {
        log.debug("Processing {}", request);
        Map<String, String> data = request.projection();
        List<Rule> rules = controller.getRules();

        for (int i = 0; i < rules.size(); i++) {
            if (cancelRequested) {
                log.info("Shutting down, skipping remaining rules for {}", request);
                return;
            }

            Rule rule = rules.get(i);
            boolean match;
            try {
                match = rule.matches(data);
            } catch (RuntimeException e) {
                log.error("Rule evaluation failed for rule {}", i + 1, e);
                continue;
            }
            if (!match) {
                continue;
            }

            log.debug("Rule {} matches, executing action", i + 1);
            try {
                actionExecutor.execute(request, rule.action());
            } catch (IOException | RuntimeException e) {
                log.error("Unable to execute action of rule {}", i + 1, e);
            }
        }
    }

    private void drain(LinkedBlockingDeque<Signal> requests) {
        List<Signal> pending = new ArrayList<>();
        requests.drainTo(pending);
        long dropped = pending.stream().filter(s -> s != CANCEL).count();
        if (dropped > 0) {
            log.warn("Dropping {} queued requests on shutdown", dropped);
        }
    }

    public WorkerState getState() {
        return state.get();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }
}
