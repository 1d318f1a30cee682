package com.lanparty.booking.dto.response;

import java.util.List;

/**
 * A page of reservations: {@code total} rows match the filter, {@code count} are returned.
 */
public record ReservationListResponse(
    long total,
    int count,
    List<ReservationResponse> items
) {
    public static ReservationListResponse of(long total, List<ReservationResponse> items) {
        return new ReservationListResponse(total, items.size(), items);
    }
}
