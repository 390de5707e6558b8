package com.umitunal.hybridq.model;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;
import com.umitunal.hybridq.core.JobView;

import java.time.Instant;

/**
 * Mutable job record owned by the queue manager.
 * Not thread-safe: callers hold the queue's write lock while mutating it.
 */
public class WorkUnit implements Job {
    private final long id;
    private final String cmdline;
    private final Long expectedDuration;
    private final String notifyCmd;
    private final Instant submittedAt;

    private Status status;
    private Integer exitCode;
    private String failureReason;
    private Instant startedAt;
    private Instant finishedAt;
    private JobOutput output;

    public WorkUnit(long id, String cmdline, Long expectedDuration, String notifyCmd, Instant submittedAt) {
        this.id = id;
        this.cmdline = cmdline;
        this.expectedDuration = expectedDuration;
        this.notifyCmd = notifyCmd;
        this.submittedAt = submittedAt;
        this.status = Status.QUEUED;
        this.output = JobOutput.EMPTY;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getCmdline() {
        return cmdline;
    }

    @Override
    public Long getExpectedDuration() {
        return expectedDuration;
    }

    @Override
    public String getNotifyCmd() {
        return notifyCmd;
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public Integer getExitCode() {
        return exitCode;
    }

    @Override
    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public Instant getSubmittedAt() {
        return submittedAt;
    }

    @Override
    public Instant getStartedAt() {
        return startedAt;
    }

    @Override
    public Instant getFinishedAt() {
        return finishedAt;
    }

    @Override
    public String getStdout() {
        return output.getStdout();
    }

    @Override
    public String getStderr() {
        return output.getStderr();
    }

    public void start(Instant now) throws HybridQueueException {
        advanceTo(Status.RUNNING);
        this.startedAt = notBefore(now, submittedAt);
    }

    public void complete(int exitCode, JobOutput output, Instant now) throws HybridQueueException {
        advanceTo(Status.COMPLETED);
        this.exitCode = exitCode;
        this.output = output == null ? JobOutput.EMPTY : output;
        this.finishedAt = after(now, startedAt);
    }

    public void fail(String reason, JobOutput output, Instant now) throws HybridQueueException {
        advanceTo(Status.FAILED);
        this.failureReason = reason;
        this.output = output == null ? JobOutput.EMPTY : output;
        this.finishedAt = after(now, startedAt);
    }

    public JobView toView() {
        return JobView.copyOf(this);
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id=%d, status=%s, cmdline='%s', submitted=%s}",
                id, status, cmdline, submittedAt);
    }

    private void advanceTo(Status next) throws HybridQueueException {
        if (!status.canAdvanceTo(next)) {
            throw new HybridQueueException(ErrorKind.INVALID_TRANSITION,
                    "Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    // Wall clock may step backwards; timestamps must not.
    private static Instant notBefore(Instant now, Instant previous) {
        return now.isBefore(previous) ? previous : now;
    }

    // A job that ends within one clock tick still finishes after it started.
    private static Instant after(Instant now, Instant previous) {
        return now.isAfter(previous) ? now : previous.plusNanos(1);
    }
}
