package com.umitunal.hybridq.core;

import java.util.Collection;

/**
 * Per-status job counts, taken from one consistent snapshot.
 */
public class QueueMetrics {
    private final long totalJobs;
    private final long queuedJobs;
    private final long runningJobs;
    private final long completedJobs;
    private final long failedJobs;

    public QueueMetrics(long totalJobs, long queuedJobs, long runningJobs,
                        long completedJobs, long failedJobs) {
        this.totalJobs = totalJobs;
        this.queuedJobs = queuedJobs;
        this.runningJobs = runningJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
    }

    /**
     * Count the jobs of a snapshot by status.
     */
    public static QueueMetrics of(Collection<? extends Job> jobs) {
        long queued = 0;
        long running = 0;
        long completed = 0;
        long failed = 0;

        for (Job job : jobs) {
            switch (job.getStatus()) {
                case QUEUED -> queued++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }

        return new QueueMetrics(jobs.size(), queued, running, completed, failed);
    }

    public long getTotalJobs() { return totalJobs; }
    public long getQueuedJobs() { return queuedJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{total=%d, queued=%d, running=%d, completed=%d, failed=%d}",
            totalJobs, queuedJobs, runningJobs, completedJobs, failedJobs
        );
    }
}
