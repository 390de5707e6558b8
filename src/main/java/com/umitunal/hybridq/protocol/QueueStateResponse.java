package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.QueueState;

import java.util.Objects;

public final class QueueStateResponse extends Response {
    private final QueueState state;

    @JsonCreator
    public QueueStateResponse(@JsonProperty(value = "state", required = true) QueueState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public QueueState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QueueStateResponse && ((QueueStateResponse) o).state == state;
    }

    @Override
    public int hashCode() {
        return state.hashCode();
    }

    @Override
    public String toString() {
        return "QueueStateResponse{state=" + state + "}";
    }
}
