package com.lanparty.booking.repository;

import com.lanparty.booking.entity.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long>,
        JpaSpecificationExecutor<Reservation> {

    @Query("SELECT r FROM Reservation r WHERE r.station.id = :stationId")
    List<Reservation> findAllByStationId(@Param("stationId") Long stationId);

    @Query("SELECT r FROM Reservation r JOIN FETCH r.station JOIN FETCH r.user WHERE r.id = :id")
    Optional<Reservation> findByIdWithStationAndUser(@Param("id") Long id);

    @Query("SELECT r FROM Reservation r JOIN FETCH r.station JOIN FETCH r.user ORDER BY r.startTime ASC, r.id ASC")
    List<Reservation> findAllWithStationAndUserOrderByStartTime();
}
