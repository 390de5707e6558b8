package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class SubmitRequest extends Request {
    private final String cmdline;
    private final Long expectedDuration;
    private final String notifyCmd;

    @JsonCreator
    public SubmitRequest(@JsonProperty("cmdline") String cmdline,
                         @JsonProperty("expected_duration") Long expectedDuration,
                         @JsonProperty("notify_cmd") String notifyCmd) {
        this.cmdline = cmdline;
        this.expectedDuration = expectedDuration;
        this.notifyCmd = notifyCmd;
    }

    public SubmitRequest(String cmdline) {
        this(cmdline, null, null);
    }

    public String getCmdline() { return cmdline; }
    public Long getExpectedDuration() { return expectedDuration; }
    public String getNotifyCmd() { return notifyCmd; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubmitRequest)) return false;
        SubmitRequest that = (SubmitRequest) o;
        return Objects.equals(cmdline, that.cmdline)
                && Objects.equals(expectedDuration, that.expectedDuration)
                && Objects.equals(notifyCmd, that.notifyCmd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cmdline, expectedDuration, notifyCmd);
    }

    @Override
    public String toString() {
        return "SubmitRequest{cmdline='" + cmdline + "', expectedDuration=" + expectedDuration
                + ", notifyCmd=" + notifyCmd + "}";
    }
}
