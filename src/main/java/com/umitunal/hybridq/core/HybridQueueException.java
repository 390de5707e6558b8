package com.umitunal.hybridq.core;

/**
 * Checked exception raised by every layer of the job queue service.
 * The {@link ErrorKind} decides how the failure propagates: queue errors are
 * answered to the client, protocol and TLS errors close the connection.
 */
public class HybridQueueException extends Exception {
    private final ErrorKind kind;

    public HybridQueueException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HybridQueueException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
