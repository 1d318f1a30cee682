package com.lanparty.booking.entity;

import com.lanparty.booking.domain.Interval;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity representing a station reservation over the half-open window
 * {@code [startTime, endTime)}.
 *
 * <p>No two reservations on the same station may overlap unless one of them is
 * {@link ReservationStatus#CANCELLED}. {@code ReservationService} enforces this under a
 * per-station row lock; the exclusion constraint {@code ex_reservations_station_no_overlap}
 * (V3 migration) enforces it again at commit:
 * <pre>
 *   EXCLUDE USING gist (station_id WITH =, tstzrange(start_time, end_time, '[)') WITH &amp;&amp;)
 *       WHERE (status &lt;&gt; 'CANCELLED')
 * </pre>
 * {@code start_time < end_time} is a CHECK constraint on the table.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards against two requests editing
 * the same reservation at once. The losing request receives
 * {@code ObjectOptimisticLockingFailureException}, mapped to 409 by
 * {@code GlobalExceptionHandler}.
 *
 * <p>{@code station} and {@code user} are {@code LAZY}; reads that need them go through the
 * fetch-join queries in {@code ReservationRepository}. {@code @ToString} is omitted so logging
 * never triggers a lazy load.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** The reserved station. FK with {@code ON DELETE RESTRICT}. */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "station_id", nullable = false)
    private Station station;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    /** Inclusive start of the reserved window. */
    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    /** Exclusive end of the reserved window. */
    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public Interval interval() {
        return new Interval(startTime, endTime);
    }
}
