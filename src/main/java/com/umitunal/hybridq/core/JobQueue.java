package com.umitunal.hybridq.core;

import java.util.List;

/**
 * The authoritative store of all jobs known to a daemon.
 * Implementations serialize every mutation; at most one job is RUNNING at a time.
 */
public interface JobQueue {

    /**
     * Append a QUEUED job to the tail of the queue. Never waits for execution.
     *
     * @param cmdline the command line, must not be blank
     * @param expectedDuration informational duration estimate in seconds, or null
     * @param notifyCmd command to run once the job terminates, or null
     * @return the id assigned to the job
     * @throws HybridQueueException INVALID_REQUEST if the command line is blank
     */
    long submit(String cmdline, Long expectedDuration, String notifyCmd) throws HybridQueueException;

    /**
     * Get a consistent, immutable copy of every job in submission order.
     */
    List<JobView> snapshot();

    /**
     * Start the head QUEUED job if the queue is RUNNING and no job is running.
     *
     * @return the job now RUNNING, or null if the queue is idle, stopped or a job is already running
     */
    JobView tryStartNext();

    /**
     * Mark a RUNNING job as completed with the given exit code.
     *
     * @throws HybridQueueException NOT_FOUND or INVALID_TRANSITION
     */
    JobView completeJob(long id, int exitCode, JobOutput output) throws HybridQueueException;

    /**
     * Mark a RUNNING job as failed.
     *
     * @throws HybridQueueException NOT_FOUND or INVALID_TRANSITION
     */
    JobView failJob(long id, String reason, JobOutput output) throws HybridQueueException;

    default JobView completeJob(long id, int exitCode) throws HybridQueueException {
        return completeJob(id, exitCode, JobOutput.EMPTY);
    }

    default JobView failJob(long id, String reason) throws HybridQueueException {
        return failJob(id, reason, JobOutput.EMPTY);
    }

    /**
     * Look up a single job.
     *
     * @return a copy of the job, or null if the id is unknown or was removed
     */
    JobView find(long id);

    /**
     * Drop a terminal job from the retained set.
     *
     * @throws HybridQueueException NOT_FOUND, or INVALID_TRANSITION if the job has not terminated
     */
    JobView remove(long id) throws HybridQueueException;

    QueueState getQueueState();

    /**
     * Pause or resume job starts. Stopping while a job runs yields STOPPING until that job
     * terminates, then STOPPED. Jobs already queued stay queued.
     *
     * @param requested RUNNING to resume, STOPPING or STOPPED to pause
     * @return the state now in effect
     */
    QueueState setQueueState(QueueState requested);

    /**
     * Get statistics about the queue.
     */
    QueueMetrics getMetrics();

    /**
     * Register a callback invoked after every successful submit and whenever the queue is resumed,
     * outside the queue's lock.
     */
    void addSubmitListener(Runnable listener);
}
