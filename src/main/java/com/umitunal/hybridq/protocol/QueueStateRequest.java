package com.umitunal.hybridq.protocol;

public final class QueueStateRequest extends Request {

    @Override
    public boolean equals(Object o) {
        return o instanceof QueueStateRequest;
    }

    @Override
    public int hashCode() {
        return QueueStateRequest.class.hashCode();
    }

    @Override
    public String toString() {
        return "QueueStateRequest{}";
    }
}
