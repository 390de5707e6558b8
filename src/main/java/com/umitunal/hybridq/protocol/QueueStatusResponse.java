package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.JobView;

import java.util.List;

public final class QueueStatusResponse extends Response {
    private final List<JobView> jobs;

    @JsonCreator
    public QueueStatusResponse(@JsonProperty("jobs") List<JobView> jobs) {
        this.jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    /**
     * Gets the jobs in queue order: terminal, running and queued jobs by submission.
     */
    public List<JobView> getJobs() {
        return jobs;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QueueStatusResponse && ((QueueStatusResponse) o).jobs.equals(jobs);
    }

    @Override
    public int hashCode() {
        return jobs.hashCode();
    }

    @Override
    public String toString() {
        return "QueueStatusResponse{jobs=" + jobs + "}";
    }
}
