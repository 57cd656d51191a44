package com.proximity.hotels.domain.exception;

import java.util.UUID;

public class HotelNotFoundException extends DomainException {

    private final UUID hotelId;

    public HotelNotFoundException(UUID hotelId) {
        super(ErrorKind.NOT_FOUND, "Hotel with ID '" + hotelId + "' was not found.");
        this.hotelId = hotelId;
    }

    public UUID getHotelId() {
        return hotelId;
    }
}
