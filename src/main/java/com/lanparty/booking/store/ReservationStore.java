package com.lanparty.booking.store;

import com.lanparty.booking.entity.Reservation;

import java.util.List;
import java.util.function.Consumer;

/**
 * Durable storage of reservations.
 *
 * <p>Methods that write must be called inside the caller's transaction: the engine reads the
 * conflict candidates and writes within one transaction while holding the station lock.
 * Writes flush immediately so that a violated overlap constraint surfaces as
 * {@code ReservationConflictException} before the caller returns.
 */
public interface ReservationStore {

    long count();

    /** All reservations of a station, any status. */
    List<Reservation> listByResource(Long stationId);

    /** Filtered page ordered by start time, most recent first. */
    ReservationPage findByFilter(ReservationFilter filter);

    /** Every reservation ordered by start time, earliest first, station and user attached. */
    List<Reservation> findAllOrderedByStart();

    /**
     * @throws com.lanparty.booking.exception.ResourceNotFoundException if absent
     */
    Reservation findById(Long id);

    Reservation insert(Reservation reservation);

    /**
     * Applies {@code changes} to the stored reservation and writes it. {@code updatedAt} is
     * refreshed even when {@code changes} leaves every field as it was.
     *
     * @throws com.lanparty.booking.exception.ResourceNotFoundException if absent
     */
    Reservation updateById(Long id, Consumer<Reservation> changes);

    /**
     * @throws com.lanparty.booking.exception.ResourceNotFoundException if absent
     */
    void deleteById(Long id);
}
