package com.lineguard.backend.exception;

public class LineGuardException extends RuntimeException {

    public LineGuardException(String message) {
        super(message);
    }

    public LineGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
