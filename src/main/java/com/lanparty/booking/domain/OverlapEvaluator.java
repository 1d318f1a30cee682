package com.lanparty.booking.domain;

import com.lanparty.booking.entity.Reservation;
import com.lanparty.booking.entity.ReservationStatus;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pure interval overlap checks used by the reservation engine. No I/O, no state.
 *
 * <p>Two half-open windows overlap iff {@code a.start < b.end && b.start < a.end}, so
 * back-to-back windows ({@code a.end == b.start}) never conflict.
 */
public final class OverlapEvaluator {

    private OverlapEvaluator() {}

    public static boolean overlaps(Interval candidate, Interval existing) {
        return candidate.start().isBefore(existing.end())
            && existing.start().isBefore(candidate.end());
    }

    public static boolean hasConflict(Interval candidate, Collection<Interval> existing) {
        return existing.stream().anyMatch(interval -> overlaps(candidate, interval));
    }

    /**
     * Returns the reservations that block {@code candidate}.
     *
     * @param excludeId        id of the reservation being updated, or {@code null} on create
     * @param blockingStatuses statuses that take part in conflict detection
     */
    public static List<Reservation> findConflicts(Interval candidate,
                                                  Collection<Reservation> reservations,
                                                  Long excludeId,
                                                  Set<ReservationStatus> blockingStatuses) {
        return reservations.stream()
            .filter(r -> excludeId == null || !Objects.equals(r.getId(), excludeId))
            .filter(r -> blockingStatuses.contains(r.getStatus()))
            .filter(r -> overlaps(candidate, r.interval()))
            .toList();
    }
}
