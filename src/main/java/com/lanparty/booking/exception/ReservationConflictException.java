package com.lanparty.booking.exception;

import com.lanparty.booking.domain.Interval;

public class ReservationConflictException extends ReservationException {

    public ReservationConflictException(Long stationId, Interval window) {
        super(ErrorKind.CONFLICT, "Station " + stationId + " is not available for " + window);
    }
}
