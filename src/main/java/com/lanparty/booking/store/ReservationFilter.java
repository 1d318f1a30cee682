package com.lanparty.booking.store;

import com.lanparty.booking.entity.ReservationStatus;

import java.time.Instant;

/**
 * Resolved list criteria. {@code null} fields mean "no filter"; {@code from}/{@code to} select
 * reservations whose window overlaps {@code [from, to)}. {@code limit} and {@code offset} are
 * already defaulted and clamped.
 */
public record ReservationFilter(
    ReservationStatus status,
    Long stationId,
    Long userId,
    Instant from,
    Instant to,
    int limit,
    int offset
) {
}
