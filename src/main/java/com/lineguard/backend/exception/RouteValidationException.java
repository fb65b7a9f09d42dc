package com.lineguard.backend.exception;

import lombok.Getter;

/**
 * Rejected route mutation. Raised before any write, or when the index rebuild
 * that completes the mutation fails.
 */
@Getter
public class RouteValidationException extends LineGuardException {

    // Index of the offending segment, null when the whole route is at fault
    private final Integer invalidSegmentIndex;

    public RouteValidationException(String message) {
        this(message, (Integer) null);
    }

    public RouteValidationException(String message, Integer invalidSegmentIndex) {
        super(message);
        this.invalidSegmentIndex = invalidSegmentIndex;
    }

    public RouteValidationException(String message, Throwable cause) {
        super(message, cause);
        this.invalidSegmentIndex = null;
    }
}
