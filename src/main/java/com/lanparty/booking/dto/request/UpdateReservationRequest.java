package com.lanparty.booking.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lanparty.booking.entity.ReservationStatus;
import jakarta.validation.constraints.AssertTrue;

import java.time.Instant;

/**
 * Partial update. Null fields keep the reservation's current value.
 */
public record UpdateReservationRequest(
    Long stationId,
    Long userId,
    Instant startTime,
    Instant endTime,
    ReservationStatus status
) {

    @JsonIgnore
    @AssertTrue(message = "Start time must be before end time")
    public boolean isWindowValid() {
        return startTime == null || endTime == null || startTime.isBefore(endTime);
    }
}
