package com.lanparty.booking.mapper;

import com.lanparty.booking.dto.response.ReservationResponse;
import com.lanparty.booking.entity.Reservation;
import com.lanparty.booking.entity.Station;
import com.lanparty.booking.entity.User;

public final class ReservationMapper {

    private ReservationMapper() {}

    public static ReservationResponse toResponse(Reservation reservation) {
        Station station = reservation.getStation();
        User user = reservation.getUser();
        return new ReservationResponse(
            reservation.getId(),
            new ReservationResponse.StationSummary(station.getId(), station.getName()),
            new ReservationResponse.UserSummary(user.getId(), user.getUsername()),
            reservation.getStartTime(),
            reservation.getEndTime(),
            reservation.getStatus(),
            reservation.getCreatedAt(),
            reservation.getUpdatedAt()
        );
    }
}
