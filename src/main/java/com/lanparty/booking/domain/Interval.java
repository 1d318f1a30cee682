package com.lanparty.booking.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time window {@code [start, end)}. {@code start} must be strictly before {@code end}.
 */
public record Interval(Instant start, Instant end) {

    public Interval {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                "Interval start " + start + " must be before end " + end);
        }
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
