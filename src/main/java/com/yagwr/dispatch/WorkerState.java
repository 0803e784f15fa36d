package com.yagwr.dispatch;

/**
 * Lifecycle of the {@link DispatchWorker}.
 */
public enum WorkerState {
    BOOTING,
    RUNNING,
    DRAINING,
    STOPPED
}
