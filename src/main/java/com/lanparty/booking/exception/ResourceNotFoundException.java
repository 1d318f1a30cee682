package com.lanparty.booking.exception;

public class ResourceNotFoundException extends ReservationException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(ErrorKind.NOT_FOUND, entityName + " not found with id " + id);
    }
}
