package com.umitunal.hybridq.protocol;

public final class QueueStatusRequest extends Request {

    @Override
    public boolean equals(Object o) {
        return o instanceof QueueStatusRequest;
    }

    @Override
    public int hashCode() {
        return QueueStatusRequest.class.hashCode();
    }

    @Override
    public String toString() {
        return "QueueStatusRequest{}";
    }
}
