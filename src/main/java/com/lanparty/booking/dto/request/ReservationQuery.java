package com.lanparty.booking.dto.request;

import java.time.Instant;

/**
 * Raw list parameters as received. {@code status} stays a string: an unrecognised value means
 * "no status filter" rather than a bad request.
 */
public record ReservationQuery(
    String status,
    Long stationId,
    Long userId,
    Instant from,
    Instant to,
    Integer limit,
    Integer offset
) {
    public static ReservationQuery page(Integer limit, Integer offset) {
        return new ReservationQuery(null, null, null, null, null, limit, offset);
    }
}
