package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.Job;

import java.time.Instant;
import java.util.Objects;

/**
 * Document written to the standard input of a notify command once its job has terminated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NotifyPayload {
    private final long jobId;
    private final String cmdline;
    private final Job.Status status;
    private final Integer exitCode;
    private final String failureReason;
    private final Long expectedDuration;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    @JsonCreator
    public NotifyPayload(@JsonProperty("job_id") long jobId,
                         @JsonProperty("cmdline") String cmdline,
                         @JsonProperty("status") Job.Status status,
                         @JsonProperty("exit_code") Integer exitCode,
                         @JsonProperty("failure_reason") String failureReason,
                         @JsonProperty("expected_duration") Long expectedDuration,
                         @JsonProperty("submitted_at") Instant submittedAt,
                         @JsonProperty("started_at") Instant startedAt,
                         @JsonProperty("finished_at") Instant finishedAt) {
        this.jobId = jobId;
        this.cmdline = cmdline;
        this.status = status;
        this.exitCode = exitCode;
        this.failureReason = failureReason;
        this.expectedDuration = expectedDuration;
        this.submittedAt = submittedAt;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public static NotifyPayload of(Job job) {
        return new NotifyPayload(job.getId(), job.getCmdline(), job.getStatus(), job.getExitCode(),
                job.getFailureReason(), job.getExpectedDuration(),
                job.getSubmittedAt(), job.getStartedAt(), job.getFinishedAt());
    }

    public long getJobId() { return jobId; }
    public String getCmdline() { return cmdline; }
    public Job.Status getStatus() { return status; }
    public Integer getExitCode() { return exitCode; }
    public String getFailureReason() { return failureReason; }
    public Long getExpectedDuration() { return expectedDuration; }
    public Instant getSubmittedAt() { return submittedAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotifyPayload)) return false;
        NotifyPayload that = (NotifyPayload) o;
        return jobId == that.jobId
                && Objects.equals(cmdline, that.cmdline)
                && status == that.status
                && Objects.equals(exitCode, that.exitCode)
                && Objects.equals(failureReason, that.failureReason)
                && Objects.equals(expectedDuration, that.expectedDuration)
                && Objects.equals(submittedAt, that.submittedAt)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(finishedAt, that.finishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, status, exitCode, finishedAt);
    }
}
