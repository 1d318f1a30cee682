package com.lanparty.booking.exception;

/**
 * Discriminant carried by every {@link ReservationException}. {@code GlobalExceptionHandler}
 * switches over it exhaustively, so adding a constant forces a decision about its HTTP mapping.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INVALID_TRANSITION
}
