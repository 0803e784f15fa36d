package com.yagwr.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Hosts a {@link WorkerTask} on its own named thread and stops it from any other thread.
 * <p>
 * {@link #stop()} asks the task to cancel through the task's own thread-safe channel and then
 * joins the thread. Stopping a bridge that was never started, or stopping it twice, does nothing.
 */
public class ConcurrencyBridge {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyBridge.class);

    public static final String MDC_WORKER = "worker";

    private final String name;
    private final WorkerTask task;

    private Thread thread;
    private boolean stopped;

    public ConcurrencyBridge(String name, WorkerTask task) {
        this.name = name;
        this.task = task;
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Bridge " + name + " already started");
        }
        log.debug("Starting thread {}", name);
        thread = new Thread(this::runTask, name);
        thread.setDaemon(false);
        thread.start();
    }

    private void runTask() {
        MDC.put(MDC_WORKER, name);
        try {
            task.run();
            log.debug("Worker task finished");
        } catch (InterruptedException e) {
            log.debug("Worker task interrupted");
        } catch (Exception e) {
            log.error("Worker task stopped with an error", e);
        } catch (Error e) {
            log.error("Worker task died", e);
        } finally {
            MDC.remove(MDC_WORKER);
        }
    }

    /**
     * Cancel the task and wait for the thread to exit.
     *
     * @throws InterruptedException if interrupted while joining; the worker keeps running
     */
    public void stop() throws InterruptedException {
        Thread worker;
        synchronized (this) {
            if (thread == null || stopped) {
                return;
            }
            stopped = true;
            worker = thread;
        }

        log.debug("Cancelling worker task {}", name);
        try {
            task.cancel();
        } catch (RuntimeException e) {
            log.error("Unable to cancel worker task {}", name, e);
        }

        log.debug("Joining thread {}", name);
        worker.join();
        log.info("Thread {} stopped", name);
    }

    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive();
    }
}
