package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.JobView;

import java.util.Objects;

/**
 * Carries a single job, e.g. the one removed by a remove request.
 */
public final class JobResponse extends Response {
    private final JobView job;

    @JsonCreator
    public JobResponse(@JsonProperty(value = "job", required = true) JobView job) {
        this.job = job;
    }

    public JobView getJob() {
        return job;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JobResponse && Objects.equals(((JobResponse) o).job, job);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(job);
    }

    @Override
    public String toString() {
        return "JobResponse{job=" + job + "}";
    }
}
