package com.umitunal.hybridq.core;

/**
 * Whether the queue hands out jobs.
 */
public enum QueueState {
    /** Queued jobs are started one after another. */
    RUNNING,
    /** Asked to stop while a job was running; no further job starts and the running one finishes. */
    STOPPING,
    /** No job is started until the queue is set running again. */
    STOPPED
}
