package com.lanparty.booking.unit.controller;

import com.lanparty.booking.controller.handler.GlobalExceptionHandler;
import com.lanparty.booking.domain.Interval;
import com.lanparty.booking.dto.response.ErrorResponse;
import com.lanparty.booking.entity.ReservationStatus;
import com.lanparty.booking.exception.InvalidStatusTransitionException;
import com.lanparty.booking.exception.ReservationConflictException;
import com.lanparty.booking.exception.ReservationValidationException;
import com.lanparty.booking.exception.ResourceNotFoundException;
import com.lanparty.booking.store.OverlapConstraint;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/api/v1/reservations");

    @Test
    void conflict_mapsTo409() {
        Interval window = new Interval(Instant.parse("2025-12-05T15:00:00Z"), Instant.parse("2025-12-05T17:00:00Z"));

        ResponseEntity<ErrorResponse> response =
            handler.handleReservation(new ReservationConflictException(1L, window), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().status()).isEqualTo(409);
        assertThat(response.getBody().message()).contains("Station 1");
        assertThat(response.getBody().path()).isEqualTo("/api/v1/reservations");
    }

    @Test
    void notFound_mapsTo404() {
        ResponseEntity<ErrorResponse> response =
            handler.handleReservation(new ResourceNotFoundException("Reservation", 9L), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().error()).isEqualTo("Not Found");
    }

    @Test
    void validation_mapsTo400() {
        ResponseEntity<ErrorResponse> response =
            handler.handleReservation(new ReservationValidationException("Start time must be before end time"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void invalidTransition_mapsTo409() {
        ResponseEntity<ErrorResponse> response = handler.handleReservation(
            new InvalidStatusTransitionException(3L, ReservationStatus.CONFIRMED, ReservationStatus.PENDING), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("CONFIRMED").contains("PENDING");
    }

    @Test
    void overlapConstraintViolation_mapsTo409() {
        DataIntegrityViolationException ex = new DataIntegrityViolationException("could not execute statement",
            new ConstraintViolationException("conflicting key value violates exclusion constraint",
                new SQLException("exclusion violation", "23P01"), OverlapConstraint.NAME));

        ResponseEntity<ErrorResponse> response = handler.handleDataIntegrity(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void otherIntegrityViolation_mapsTo400() {
        DataIntegrityViolationException ex = new DataIntegrityViolationException("could not execute statement",
            new ConstraintViolationException("insert or update violates foreign key constraint",
                new SQLException("fk violation", "23503"), "reservations_user_id_fkey"));

        ResponseEntity<ErrorResponse> response = handler.handleDataIntegrity(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
