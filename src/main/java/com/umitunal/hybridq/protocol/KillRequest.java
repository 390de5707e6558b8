package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class KillRequest extends Request {
    private final long jobId;

    @JsonCreator
    public KillRequest(@JsonProperty(value = "job_id", required = true) long jobId) {
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KillRequest && ((KillRequest) o).jobId == jobId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(jobId);
    }

    @Override
    public String toString() {
        return "KillRequest{jobId=" + jobId + "}";
    }
}
