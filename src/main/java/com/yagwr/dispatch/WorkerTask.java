package com.yagwr.dispatch;

/**
 * Long-lived body hosted by a {@link ConcurrencyBridge}.
 */
public interface WorkerTask {

    /**
     * Run on the bridge thread until cancelled.
     */
    void run() throws Exception;

    /**
     * Ask the task to stop. Called from a foreign thread; must not block and must wake
     * up the task if it is waiting for work.
     */
    void cancel();
}
