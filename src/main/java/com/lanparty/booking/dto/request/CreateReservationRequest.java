package com.lanparty.booking.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lanparty.booking.entity.ReservationStatus;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record CreateReservationRequest(

    @NotNull(message = "Station ID is required")
    Long stationId,

    @NotNull(message = "User ID is required")
    Long userId,

    @NotNull(message = "Start time is required")
    Instant startTime,

    @NotNull(message = "End time is required")
    Instant endTime,

    /** Defaults to {@code pending} when omitted. */
    ReservationStatus status
) {

    @JsonIgnore
    @AssertTrue(message = "Start time must be before end time")
    public boolean isWindowValid() {
        return startTime == null || endTime == null || startTime.isBefore(endTime);
    }
}
