package com.proximity.hotels.domain.exception;

/**
 * A numeric value violates a documented bound or is not finite.
 */
public class OutOfRangeException extends DomainException {

    private final String argument;
    private final transient Object actualValue;

    public OutOfRangeException(String argument, Object actualValue, String message) {
        super(ErrorKind.OUT_OF_RANGE, message);
        this.argument = argument;
        this.actualValue = actualValue;
    }

    public String getArgument() {
        return argument;
    }

    public Object getActualValue() {
        return actualValue;
    }
}
