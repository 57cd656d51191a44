package com.proximity.hotels.domain.exception;

import java.util.UUID;

public class HotelConflictException extends DomainException {

    private final UUID hotelId;

    public HotelConflictException(UUID hotelId) {
        super(ErrorKind.CONFLICT, "Hotel with ID '" + hotelId + "' already exists.");
        this.hotelId = hotelId;
    }

    public UUID getHotelId() {
        return hotelId;
    }
}
