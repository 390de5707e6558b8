package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;

import java.util.Objects;

public final class ErrorResponse extends Response {
    private final ErrorKind kind;
    private final String message;

    @JsonCreator
    public ErrorResponse(@JsonProperty(value = "kind", required = true) ErrorKind kind,
                         @JsonProperty("message") String message) {
        this.kind = kind;
        this.message = message;
    }

    public static ErrorResponse of(HybridQueueException e) {
        return new ErrorResponse(e.getKind(), e.getMessage());
    }

    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }

    public HybridQueueException toException() {
        return new HybridQueueException(kind, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorResponse)) return false;
        ErrorResponse that = (ErrorResponse) o;
        return kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return "ErrorResponse{kind=" + kind + ", message='" + message + "'}";
    }
}
