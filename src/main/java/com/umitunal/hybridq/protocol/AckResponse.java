package com.umitunal.hybridq.protocol;

public final class AckResponse extends Response {

    @Override
    public boolean equals(Object o) {
        return o instanceof AckResponse;
    }

    @Override
    public int hashCode() {
        return AckResponse.class.hashCode();
    }

    @Override
    public String toString() {
        return "AckResponse{}";
    }
}
