package com.lineguard.backend.exception;

public class ReferenceDataException extends LineGuardException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public static ReferenceDataException stationNotFound(String id) {
        return new ReferenceDataException("Station or hub with ID '" + id + "' not found");
    }

    public static ReferenceDataException lineNotFound(String id) {
        return new ReferenceDataException("Line '" + id + "' not found");
    }

    public static ReferenceDataException routeNotFound(String id) {
        return new ReferenceDataException("Route '" + id + "' not found");
    }
}
