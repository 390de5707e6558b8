package com.umitunal.hybridq.core;

import java.time.Instant;

/**
 * A command line submitted to the daemon, tracked from submission to termination.
 */
public interface Job {

    /**
     * Gets the id assigned at submission. Ids are never reused by a daemon.
     */
    long getId();

    /**
     * Gets the command line exactly as the client submitted it.
     */
    String getCmdline();

    /**
     * Gets the informational duration estimate in seconds, or null.
     */
    Long getExpectedDuration();

    /**
     * Gets the command to run on termination, or null.
     */
    String getNotifyCmd();

    /**
     * Gets the current status.
     */
    Status getStatus();

    /**
     * Gets the exit code, present only once {@link Status#COMPLETED}.
     */
    Integer getExitCode();

    /**
     * Gets the failure reason, present only once {@link Status#FAILED}.
     */
    String getFailureReason();

    Instant getSubmittedAt();

    Instant getStartedAt();

    Instant getFinishedAt();

    /**
     * Gets the captured standard output, empty until the job terminates.
     */
    String getStdout();

    /**
     * Gets the captured standard error, empty until the job terminates.
     */
    String getStderr();

    /**
     * Job statuses. Transitions only move forward:
     * QUEUED -> RUNNING -> (COMPLETED | FAILED).
     */
    enum Status {
        QUEUED,
        RUNNING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canAdvanceTo(Status next) {
            return switch (this) {
                case QUEUED -> next == RUNNING;
                case RUNNING -> next.isTerminal();
                case COMPLETED, FAILED -> false;
            };
        }
    }
}
