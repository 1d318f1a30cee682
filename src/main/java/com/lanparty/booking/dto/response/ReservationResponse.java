package com.lanparty.booking.dto.response;

import com.lanparty.booking.entity.ReservationStatus;

import java.time.Instant;

public record ReservationResponse(
    Long id,
    StationSummary station,
    UserSummary user,
    Instant startTime,
    Instant endTime,
    ReservationStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public record StationSummary(Long id, String name) {}

    public record UserSummary(Long id, String username) {}
}
