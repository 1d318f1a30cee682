package com.lanparty.booking.store;

import com.lanparty.booking.entity.Reservation;
import com.lanparty.booking.exception.ReservationConflictException;
import com.lanparty.booking.exception.ResourceNotFoundException;
import com.lanparty.booking.repository.ReservationRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link ReservationStore} backed by Spring Data JPA and PostgreSQL.
 *
 * <p>Paging uses {@code setFirstResult}/{@code setMaxResults} on a criteria query rather than a
 * {@code Pageable}, because callers page by arbitrary offset, not by page number.
 */
@Repository
@RequiredArgsConstructor
public class JpaReservationStore implements ReservationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaReservationStore.class);

    private final ReservationRepository reservationRepository;
    private final EntityManager entityManager;

    @Override
    public long count() {
        return reservationRepository.count();
    }

    @Override
    public List<Reservation> listByResource(Long stationId) {
        return reservationRepository.findAllByStationId(stationId);
    }

    @Override
    public ReservationPage findByFilter(ReservationFilter filter) {
        Specification<Reservation> spec = toSpecification(filter);
        long total = reservationRepository.count(spec);
        if (total == 0) {
            return new ReservationPage(0, List.of());
        }

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Reservation> query = cb.createQuery(Reservation.class);
        Root<Reservation> root = query.from(Reservation.class);
        root.fetch("station");
        root.fetch("user");
        Predicate predicate = spec.toPredicate(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        query.orderBy(cb.desc(root.get("startTime")), cb.desc(root.get("id")));

        List<Reservation> items = entityManager.createQuery(query)
            .setFirstResult(filter.offset())
            .setMaxResults(filter.limit())
            .getResultList();
        return new ReservationPage(total, items);
    }

    @Override
    public List<Reservation> findAllOrderedByStart() {
        return reservationRepository.findAllWithStationAndUserOrderByStartTime();
    }

    @Override
    public Reservation findById(Long id) {
        return reservationRepository.findByIdWithStationAndUser(id)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", id));
    }

    @Override
    public Reservation insert(Reservation reservation) {
        return write(reservation);
    }

    @Override
    public Reservation updateById(Long id, Consumer<Reservation> changes) {
        Reservation reservation = findById(id);
        changes.accept(reservation);
        reservation.touch();
        return write(reservation);
    }

    @Override
    public void deleteById(Long id) {
        Reservation reservation = reservationRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", id));
        reservationRepository.delete(reservation);
    }

    private Reservation write(Reservation reservation) {
        try {
            return reservationRepository.saveAndFlush(reservation);
        } catch (DataIntegrityViolationException ex) {
            if (OverlapConstraint.isViolatedBy(ex)) {
                log.warn("Overlap constraint rejected reservation on station {} for [{}, {})",
                    reservation.getStation().getId(), reservation.getStartTime(), reservation.getEndTime());
                throw new ReservationConflictException(reservation.getStation().getId(), reservation.interval());
            }
            throw ex;
        }
    }

    private Specification<Reservation> toSpecification(ReservationFilter filter) {
        Specification<Reservation> spec = Specification.where(null);

        if (filter.status() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        if (filter.stationId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("station").get("id"), filter.stationId()));
        }
        if (filter.userId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("user").get("id"), filter.userId()));
        }
        if (filter.from() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThan(root.<Instant>get("endTime"), filter.from()));
        }
        if (filter.to() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.<Instant>get("startTime"), filter.to()));
        }
        return spec;
    }
}
