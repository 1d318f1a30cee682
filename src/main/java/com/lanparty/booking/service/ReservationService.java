package com.lanparty.booking.service;

import com.lanparty.booking.config.BookingProperties;
import com.lanparty.booking.domain.Interval;
import com.lanparty.booking.domain.OverlapEvaluator;
import com.lanparty.booking.dto.request.CreateReservationRequest;
import com.lanparty.booking.dto.request.ReservationQuery;
import com.lanparty.booking.dto.request.UpdateReservationRequest;
import com.lanparty.booking.dto.response.ReservationListResponse;
import com.lanparty.booking.dto.response.ReservationResponse;
import com.lanparty.booking.entity.Reservation;
import com.lanparty.booking.entity.ReservationStatus;
import com.lanparty.booking.entity.Station;
import com.lanparty.booking.entity.User;
import com.lanparty.booking.exception.InvalidStatusTransitionException;
import com.lanparty.booking.exception.ReservationConflictException;
import com.lanparty.booking.exception.ReservationValidationException;
import com.lanparty.booking.exception.ResourceNotFoundException;
import com.lanparty.booking.mapper.ReservationMapper;
import com.lanparty.booking.repository.StationRepository;
import com.lanparty.booking.repository.UserRepository;
import com.lanparty.booking.store.ReservationStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Creates, updates, cancels and removes reservations while keeping the no-overlap invariant.
 *
 * <p>Every write runs in one transaction that first takes the station's row lock
 * ({@link StationRepository#findByIdForUpdate}), then reads the station's reservations, checks
 * them with {@link OverlapEvaluator}, and only then writes. Two requests for the same station
 * therefore serialise on the lock and the second one sees the first one's row. Requests for
 * different stations do not block each other. A failed check throws before any write, and any
 * exception rolls the transaction back.
 */
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final ReservationStore reservationStore;
    private final StationRepository stationRepository;
    private final UserRepository userRepository;
    private final ReservationQueryService reservationQueryService;
    private final BookingProperties bookingProperties;

    @Transactional
    public ReservationResponse create(CreateReservationRequest request) {
        Interval window = toWindow(request.startTime(), request.endTime());
        ReservationStatus status = request.status() != null ? request.status() : ReservationStatus.PENDING;

        Station station = lockStation(request.stationId());
        User user = findUser(request.userId());
        if (bookingProperties.blockingStatuses().contains(status)) {
            ensureAvailable(station.getId(), window, null);
        }

        Reservation reservation = new Reservation();
        reservation.setStation(station);
        reservation.setUser(user);
        reservation.setStartTime(window.start());
        reservation.setEndTime(window.end());
        reservation.setStatus(status);

        Reservation saved = reservationStore.insert(reservation);
        log.info("Created reservation {} on station {} for {}", saved.getId(), station.getId(), window);
        return ReservationMapper.toResponse(saved);
    }

    @Transactional
    public ReservationResponse update(Long id, UpdateReservationRequest request) {
        Reservation current = reservationStore.findById(id);
        ReservationStatus from = current.getStatus();
        if (from == ReservationStatus.CANCELLED) {
            throw new InvalidStatusTransitionException(id);
        }
        ReservationStatus to = request.status() != null ? request.status() : from;
        if (!from.canTransitionTo(to)) {
            throw new InvalidStatusTransitionException(id, from, to);
        }

        Long stationId = request.stationId() != null ? request.stationId() : current.getStation().getId();
        Interval window = toWindow(
            request.startTime() != null ? request.startTime() : current.getStartTime(),
            request.endTime() != null ? request.endTime() : current.getEndTime());

        Station station = lockStation(stationId);
        User user = request.userId() != null ? findUser(request.userId()) : current.getUser();
        if (bookingProperties.blockingStatuses().contains(to)) {
            ensureAvailable(stationId, window, id);
        }

        Reservation saved = reservationStore.updateById(id, reservation -> {
            reservation.setStation(station);
            reservation.setUser(user);
            reservation.setStartTime(window.start());
            reservation.setEndTime(window.end());
            reservation.setStatus(to);
        });
        log.info("Updated reservation {} on station {} for {} ({})", id, stationId, window, to);
        return ReservationMapper.toResponse(saved);
    }

    /**
     * Soft cancel: the row is kept with status {@code CANCELLED} and, unless
     * {@code booking.conflicts.include-cancelled} is set, stops blocking its window.
     */
    @Transactional
    public ReservationResponse cancel(Long id) {
        Reservation current = reservationStore.findById(id);
        if (!current.getStatus().canTransitionTo(ReservationStatus.CANCELLED)) {
            throw new InvalidStatusTransitionException(id, current.getStatus(), ReservationStatus.CANCELLED);
        }

        Reservation saved = reservationStore.updateById(id,
            reservation -> reservation.setStatus(ReservationStatus.CANCELLED));
        log.info("Cancelled reservation {}", id);
        return ReservationMapper.toResponse(saved);
    }

    @Transactional
    public void remove(Long id) {
        reservationStore.deleteById(id);
        log.info("Deleted reservation {}", id);
    }

    @Transactional(readOnly = true)
    public ReservationResponse get(Long id) {
        return ReservationMapper.toResponse(reservationStore.findById(id));
    }

    public ReservationListResponse list(ReservationQuery query) {
        return reservationQueryService.list(query);
    }

    public List<ReservationResponse> listAll() {
        return reservationQueryService.listAll();
    }

    public long count() {
        return reservationQueryService.count();
    }

    private Interval toWindow(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new ReservationValidationException("Start time and end time are required");
        }
        if (!start.isBefore(end)) {
            throw new ReservationValidationException("Start time must be before end time");
        }
        return new Interval(start, end);
    }

    private Station lockStation(Long stationId) {
        if (stationId == null) {
            throw new ReservationValidationException("Station ID is required");
        }
        stationRepository.setLockTimeout(
            bookingProperties.getLocking().getStationLockTimeout().toMillis() + "ms");
        return stationRepository.findByIdForUpdate(stationId)
            .orElseThrow(() -> new ResourceNotFoundException("Station", stationId));
    }

    private User findUser(Long userId) {
        if (userId == null) {
            throw new ReservationValidationException("User ID is required");
        }
        return userRepository.findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    private void ensureAvailable(Long stationId, Interval window, Long excludeId) {
        Set<ReservationStatus> blocking = bookingProperties.blockingStatuses();
        List<Reservation> conflicts = OverlapEvaluator.findConflicts(
            window, reservationStore.listByResource(stationId), excludeId, blocking);
        if (!conflicts.isEmpty()) {
            log.debug("Station {} window {} overlaps reservations {}", stationId, window,
                conflicts.stream().map(Reservation::getId).toList());
            log.warn("Rejected reservation on station {} for {}: slot taken", stationId, window);
            throw new ReservationConflictException(stationId, window);
        }
    }
}
