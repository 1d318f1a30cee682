package com.lanparty.booking.service;

import com.lanparty.booking.config.BookingProperties;
import com.lanparty.booking.dto.request.ReservationQuery;
import com.lanparty.booking.dto.response.ReservationListResponse;
import com.lanparty.booking.dto.response.ReservationResponse;
import com.lanparty.booking.entity.ReservationStatus;
import com.lanparty.booking.exception.ReservationValidationException;
import com.lanparty.booking.mapper.ReservationMapper;
import com.lanparty.booking.store.ReservationFilter;
import com.lanparty.booking.store.ReservationPage;
import com.lanparty.booking.store.ReservationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only listing over the reservation store. Never consults the overlap evaluator and gives
 * no ordering guarantee relative to concurrent writes beyond read-committed.
 */
@Service
@RequiredArgsConstructor
public class ReservationQueryService {

    private final ReservationStore reservationStore;
    private final BookingProperties properties;

    @Transactional(readOnly = true)
    public ReservationListResponse list(ReservationQuery query) {
        ReservationPage page = reservationStore.findByFilter(resolve(query));
        List<ReservationResponse> items = page.items().stream()
            .map(ReservationMapper::toResponse)
            .toList();
        return ReservationListResponse.of(page.total(), items);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listAll() {
        return reservationStore.findAllOrderedByStart().stream()
            .map(ReservationMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public long count() {
        return reservationStore.count();
    }

    private ReservationFilter resolve(ReservationQuery query) {
        if (query.from() != null && query.to() != null && !query.from().isBefore(query.to())) {
            throw new ReservationValidationException("'from' must be before 'to'");
        }

        BookingProperties.Query limits = properties.getQuery();
        int limit = query.limit() == null || query.limit() <= 0
            ? limits.getDefaultLimit()
            : Math.min(query.limit(), limits.getMaxLimit());
        int offset = query.offset() == null || query.offset() < 0 ? 0 : query.offset();
        ReservationStatus status = ReservationStatus.parse(query.status()).orElse(null);

        return new ReservationFilter(status, query.stationId(), query.userId(),
            query.from(), query.to(), limit, offset);
    }
}
