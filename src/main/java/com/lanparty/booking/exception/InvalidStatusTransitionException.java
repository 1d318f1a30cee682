package com.lanparty.booking.exception;

import com.lanparty.booking.entity.ReservationStatus;

public class InvalidStatusTransitionException extends ReservationException {

    public InvalidStatusTransitionException(Long reservationId, ReservationStatus from, ReservationStatus to) {
        super(ErrorKind.INVALID_TRANSITION,
            "Reservation " + reservationId + " cannot move from " + from + " to " + to);
    }

    public InvalidStatusTransitionException(Long reservationId) {
        super(ErrorKind.INVALID_TRANSITION,
            "Reservation " + reservationId + " is CANCELLED and can no longer be modified");
    }
}
