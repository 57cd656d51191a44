package com.proximity.hotels.domain.exception;

/**
 * Malformed input independent of any numeric range, e.g. a blank hotel name.
 */
public class InvalidArgumentException extends DomainException {

    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
