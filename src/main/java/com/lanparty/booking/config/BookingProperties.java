package com.lanparty.booking.config;

import com.lanparty.booking.entity.ReservationStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings bound from the {@code booking.*} keys of {@code application.yml}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    @Valid
    private Query query = new Query();

    @Valid
    private Conflicts conflicts = new Conflicts();

    @Valid
    private Locking locking = new Locking();

    /**
     * Statuses whose reservations block an overlapping window on the same station.
     */
    public Set<ReservationStatus> blockingStatuses() {
        return conflicts.isIncludeCancelled()
            ? EnumSet.allOf(ReservationStatus.class)
            : EnumSet.of(ReservationStatus.PENDING, ReservationStatus.CONFIRMED);
    }

    @Getter
    @Setter
    public static class Query {

        /** Page size used when a list request gives no (or a non-positive) limit. */
        @Min(1)
        private int defaultLimit = 10;

        /** Upper bound applied to any requested limit. */
        @Min(1)
        private int maxLimit = 100;
    }

    @Getter
    @Setter
    public static class Conflicts {

        /**
         * When {@code true}, cancelled reservations keep blocking their window. The database
         * exclusion constraint ignores cancelled rows either way.
         */
        private boolean includeCancelled = false;
    }

    @Getter
    @Setter
    public static class Locking {

        /** How long a write waits for another write on the same station before giving up with 409. */
        @NotNull
        private Duration stationLockTimeout = Duration.ofSeconds(5);
    }
}
