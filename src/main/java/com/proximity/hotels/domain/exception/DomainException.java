package com.proximity.hotels.domain.exception;

/**
 * Base class for failures raised by the hotel domain. All of them are caused by the
 * caller's input and are never worth retrying.
 */
public abstract class DomainException extends RuntimeException {

    private final ErrorKind kind;

    protected DomainException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
