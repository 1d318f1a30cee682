package com.lanparty.booking.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle states for a {@link Reservation}.
 *
 * <p>Stored as {@code VARCHAR} via {@code @Enumerated(EnumType.STRING)}; rendered in JSON in
 * lower case ({@code "pending"}, {@code "confirmed"}, {@code "cancelled"}) and accepted in any
 * case on input.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>{@link #PENDING}   → {@code PENDING}, {@code CONFIRMED}, {@code CANCELLED}</li>
 *   <li>{@link #CONFIRMED} → {@code CONFIRMED}, {@code CANCELLED}</li>
 *   <li>{@link #CANCELLED} → terminal, nothing (not even itself)</li>
 * </ul>
 */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED;

    public boolean canTransitionTo(ReservationStatus target) {
        return switch (this) {
            case PENDING -> true;
            case CONFIRMED -> target != PENDING;
            case CANCELLED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReservationStatus fromValue(String value) {
        return parse(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown reservation status: " + value));
    }

    /**
     * Lenient, case-insensitive lookup. Blank or unrecognised input yields an empty result so
     * that list filters can treat it as "no filter".
     */
    public static Optional<ReservationStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(status -> status.name().equals(normalized))
            .findFirst();
    }
}
