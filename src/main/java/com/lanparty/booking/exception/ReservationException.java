package com.lanparty.booking.exception;

/**
 * Base type for the domain failures raised by the reservation engine. None of them is retried
 * by the engine; choosing another window or id is the caller's decision.
 */
public abstract class ReservationException extends RuntimeException {

    private final ErrorKind kind;

    protected ReservationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
