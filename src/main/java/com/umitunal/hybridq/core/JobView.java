package com.umitunal.hybridq.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable copy of a job, as handed out by queue snapshots and sent over the wire.
 */
public final class JobView implements Job {
    private final long id;
    private final String cmdline;
    private final Long expectedDuration;
    private final String notifyCmd;
    private final Status status;
    private final Integer exitCode;
    private final String failureReason;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String stdout;
    private final String stderr;

    @JsonCreator
    public JobView(@JsonProperty("id") long id,
                   @JsonProperty("cmdline") String cmdline,
                   @JsonProperty("expected_duration") Long expectedDuration,
                   @JsonProperty("notify_cmd") String notifyCmd,
                   @JsonProperty("status") Status status,
                   @JsonProperty("exit_code") Integer exitCode,
                   @JsonProperty("failure_reason") String failureReason,
                   @JsonProperty("submitted_at") Instant submittedAt,
                   @JsonProperty("started_at") Instant startedAt,
                   @JsonProperty("finished_at") Instant finishedAt,
                   @JsonProperty("stdout") String stdout,
                   @JsonProperty("stderr") String stderr) {
        this.id = id;
        this.cmdline = cmdline;
        this.expectedDuration = expectedDuration;
        this.notifyCmd = notifyCmd;
        this.status = status;
        this.exitCode = exitCode;
        this.failureReason = failureReason;
        this.submittedAt = submittedAt;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public static JobView copyOf(Job job) {
        if (job instanceof JobView) {
            return (JobView) job;
        }
        return new JobView(job.getId(), job.getCmdline(), job.getExpectedDuration(), job.getNotifyCmd(),
                job.getStatus(), job.getExitCode(), job.getFailureReason(),
                job.getSubmittedAt(), job.getStartedAt(), job.getFinishedAt(),
                job.getStdout(), job.getStderr());
    }

    @Override public long getId() { return id; }
    @Override public String getCmdline() { return cmdline; }
    @Override public Long getExpectedDuration() { return expectedDuration; }
    @Override public String getNotifyCmd() { return notifyCmd; }
    @Override public Status getStatus() { return status; }
    @Override public Integer getExitCode() { return exitCode; }
    @Override public String getFailureReason() { return failureReason; }
    @Override public Instant getSubmittedAt() { return submittedAt; }
    @Override public Instant getStartedAt() { return startedAt; }
    @Override public Instant getFinishedAt() { return finishedAt; }
    @Override public String getStdout() { return stdout; }
    @Override public String getStderr() { return stderr; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobView)) return false;
        JobView that = (JobView) o;
        return id == that.id
                && Objects.equals(cmdline, that.cmdline)
                && Objects.equals(expectedDuration, that.expectedDuration)
                && Objects.equals(notifyCmd, that.notifyCmd)
                && status == that.status
                && Objects.equals(exitCode, that.exitCode)
                && Objects.equals(failureReason, that.failureReason)
                && Objects.equals(submittedAt, that.submittedAt)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(finishedAt, that.finishedAt)
                && stdout.equals(that.stdout)
                && stderr.equals(that.stderr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cmdline, status, exitCode, submittedAt, startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return String.format("JobView{id=%d, status=%s, cmdline='%s', exitCode=%s, reason=%s}",
                id, status, cmdline, exitCode, failureReason);
    }
}
