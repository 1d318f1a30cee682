package com.lanparty.booking.exception;

public class ReservationValidationException extends ReservationException {

    public ReservationValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
