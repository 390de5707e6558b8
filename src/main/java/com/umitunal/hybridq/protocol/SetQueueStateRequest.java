package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.QueueState;

import java.util.Objects;

/**
 * Pause or resume the queue.
 */
public final class SetQueueStateRequest extends Request {
    private final QueueState state;

    @JsonCreator
    public SetQueueStateRequest(@JsonProperty(value = "state", required = true) QueueState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public QueueState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SetQueueStateRequest && ((SetQueueStateRequest) o).state == state;
    }

    @Override
    public int hashCode() {
        return state.hashCode();
    }

    @Override
    public String toString() {
        return "SetQueueStateRequest{state=" + state + "}";
    }
}
