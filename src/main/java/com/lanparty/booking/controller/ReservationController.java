package com.lanparty.booking.controller;

import com.lanparty.booking.dto.request.CreateReservationRequest;
import com.lanparty.booking.dto.request.ReservationQuery;
import com.lanparty.booking.dto.request.UpdateReservationRequest;
import com.lanparty.booking.dto.response.CountResponse;
import com.lanparty.booking.dto.response.ReservationListResponse;
import com.lanparty.booking.dto.response.ReservationResponse;
import com.lanparty.booking.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "Station reservations with overlap detection")
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    @Operation(summary = "Create a reservation", description = "Reserves a station for the window "
        + "[startTime, endTime). Fails with 409 if the window overlaps another reservation on the same station. "
        + "Back-to-back windows are allowed.")
    @ApiResponse(responseCode = "201", description = "Reservation created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Station or user not found")
    @ApiResponse(responseCode = "409", description = "Station not available for that window")
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody CreateReservationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reservationService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a reservation", description = "Partial update: null fields keep their value. "
        + "The new window is checked against the station's other reservations.")
    @ApiResponse(responseCode = "200", description = "Reservation updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Reservation, station or user not found")
    @ApiResponse(responseCode = "409", description = "Window conflict or illegal status transition")
    public ResponseEntity<ReservationResponse> update(@PathVariable Long id,
                                                      @Valid @RequestBody UpdateReservationRequest request) {
        return ResponseEntity.ok(reservationService.update(id, request));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a reservation", description = "Marks the reservation cancelled. The record is retained.")
    @ApiResponse(responseCode = "200", description = "Reservation cancelled")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    @ApiResponse(responseCode = "409", description = "Reservation already cancelled")
    public ResponseEntity<ReservationResponse> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(reservationService.cancel(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a reservation")
    @ApiResponse(responseCode = "204", description = "Reservation deleted")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<Void> remove(@PathVariable Long id) {
        reservationService.remove(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get reservation by ID", description = "Includes the station and user summaries.")
    @ApiResponse(responseCode = "200", description = "Reservation found")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<ReservationResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(reservationService.get(id));
    }

    @GetMapping
    @Operation(summary = "List reservations", description = "Filtered page ordered by start time, most recent first.")
    public ResponseEntity<ReservationListResponse> list(
            @Parameter(description = "Filter by status (pending, confirmed, cancelled); unknown values are ignored")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by station ID") @RequestParam(required = false) Long stationId,
            @Parameter(description = "Filter by user ID") @RequestParam(required = false) Long userId,
            @Parameter(description = "Only reservations ending after this instant")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @Parameter(description = "Only reservations starting before this instant")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "Page size (default 10)") @RequestParam(required = false) Integer limit,
            @Parameter(description = "Rows to skip (default 0)") @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(reservationService.list(
            new ReservationQuery(status, stationId, userId, from, to, limit, offset)));
    }

    @GetMapping("/all")
    @Operation(summary = "List every reservation", description = "No pagination, ordered by start time ascending.")
    public ResponseEntity<List<ReservationResponse>> listAll() {
        return ResponseEntity.ok(reservationService.listAll());
    }

    @GetMapping("/count")
    @Operation(summary = "Count reservations")
    public ResponseEntity<CountResponse> count() {
        return ResponseEntity.ok(new CountResponse(reservationService.count()));
    }
}
