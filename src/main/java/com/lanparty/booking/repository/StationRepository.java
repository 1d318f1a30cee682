package com.lanparty.booking.repository;

import com.lanparty.booking.entity.Station;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StationRepository extends JpaRepository<Station, Long> {

    /**
     * Loads the station with {@code SELECT ... FOR UPDATE}. Held until the surrounding
     * transaction commits, this row lock is the per-station critical section for
     * reservation writes. Waits at most as long as the transaction's {@code lock_timeout}
     * (see {@link #setLockTimeout}).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Station s WHERE s.id = :id")
    Optional<Station> findByIdForUpdate(@Param("id") Long id);

    /**
     * Sets PostgreSQL's {@code lock_timeout} for the rest of the current transaction, e.g.
     * {@code "5000ms"}. A lock wait that exceeds it fails with SQLSTATE 55P03.
     */
    @Query(value = "SELECT set_config('lock_timeout', :timeout, true)", nativeQuery = true)
    String setLockTimeout(@Param("timeout") String timeout);
}
