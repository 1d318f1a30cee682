package com.lanparty.booking.unit.domain;

import com.lanparty.booking.domain.Interval;
import com.lanparty.booking.domain.OverlapEvaluator;
import com.lanparty.booking.entity.Reservation;
import com.lanparty.booking.entity.ReservationStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverlapEvaluatorTest {

    private static final Instant BASE = Instant.parse("2025-12-05T00:00:00Z");

    @ParameterizedTest(name = "[{0},{1}) vs [{2},{3}) -> {4}")
    @CsvSource({
        // candidate     existing       overlaps
        "14, 16,         14, 16,        true",   // identical
        "15, 17,         14, 16,        true",   // tail overlap
        "13, 15,         14, 16,        true",   // head overlap
        "14, 18,         15, 16,        true",   // candidate contains existing
        "15, 16,         14, 18,        true",   // existing contains candidate
        "16, 18,         14, 16,        false",  // back-to-back after
        "12, 14,         14, 16,        false",  // back-to-back before
        "17, 18,         14, 16,        false",  // disjoint
    })
    void overlaps_followsHalfOpenSemantics(int cs, int ce, int es, int ee, boolean expected) {
        Interval candidate = window(cs, ce);
        Interval existing = window(es, ee);

        assertThat(OverlapEvaluator.overlaps(candidate, existing)).isEqualTo(expected);
        assertThat(OverlapEvaluator.overlaps(existing, candidate)).isEqualTo(expected);
    }

    @Test
    void hasConflict_isTrueWhenAnyMemberOverlaps() {
        List<Interval> existing = List.of(window(10, 11), window(14, 16));

        assertThat(OverlapEvaluator.hasConflict(window(15, 17), existing)).isTrue();
        assertThat(OverlapEvaluator.hasConflict(window(11, 14), existing)).isFalse();
    }

    @Test
    void hasConflict_withEmptySet_isFalse() {
        assertThat(OverlapEvaluator.hasConflict(window(10, 11), List.of())).isFalse();
    }

    @Test
    void findConflicts_excludesReservationBeingUpdated() {
        Reservation self = reservation(1L, 14, 16, ReservationStatus.CONFIRMED);
        Reservation other = reservation(2L, 16, 18, ReservationStatus.PENDING);

        List<Reservation> conflicts = OverlapEvaluator.findConflicts(
            window(15, 16), List.of(self, other), 1L, EnumSet.allOf(ReservationStatus.class));

        assertThat(conflicts).isEmpty();
    }

    @Test
    void findConflicts_returnsOnlyOverlappingBlockingReservations() {
        Reservation cancelled = reservation(1L, 14, 16, ReservationStatus.CANCELLED);
        Reservation pending = reservation(2L, 15, 17, ReservationStatus.PENDING);
        Reservation later = reservation(3L, 18, 19, ReservationStatus.CONFIRMED);

        List<Reservation> conflicts = OverlapEvaluator.findConflicts(
            window(14, 18), List.of(cancelled, pending, later), null,
            EnumSet.of(ReservationStatus.PENDING, ReservationStatus.CONFIRMED));

        assertThat(conflicts).extracting(Reservation::getId).containsExactly(2L);
    }

    @Test
    void interval_rejectsEmptyAndInvertedWindows() {
        assertThatThrownBy(() -> window(14, 14)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> window(16, 14)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Interval(null, BASE)).isInstanceOf(NullPointerException.class);
    }

    private static Interval window(int startHour, int endHour) {
        return new Interval(BASE.plusSeconds(startHour * 3600L), BASE.plusSeconds(endHour * 3600L));
    }

    private static Reservation reservation(Long id, int startHour, int endHour, ReservationStatus status) {
        Reservation reservation = new Reservation();
        ReflectionTestUtils.setField(reservation, "id", id);
        reservation.setStartTime(BASE.plusSeconds(startHour * 3600L));
        reservation.setEndTime(BASE.plusSeconds(endHour * 3600L));
        reservation.setStatus(status);
        return reservation;
    }
}
