package com.lanparty.booking.store;

import com.lanparty.booking.entity.Reservation;

import java.util.List;

/**
 * One page of reservations plus the number of rows matching the filter.
 */
public record ReservationPage(long total, List<Reservation> items) {}
