package com.lanparty.booking.store;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * The PostgreSQL exclusion constraint that rejects overlapping non-cancelled reservations on the
 * same station (V3 migration).
 */
public final class OverlapConstraint {

    public static final String NAME = "ex_reservations_station_no_overlap";

    private OverlapConstraint() {}

    public static boolean isViolatedBy(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
            return NAME.equals(cve.getConstraintName());
        }
        // some drivers leave the constraint name unresolved; fall back to the server message
        String message = ex.getMostSpecificCause().getMessage();
        return message != null && message.contains(NAME);
    }
}
