package com.proximity.hotels.domain.exception;

/**
 * Stable classification of domain failures. The web layer maps each kind to a status code.
 */
public enum ErrorKind {
    INVALID_ARGUMENT,
    OUT_OF_RANGE,
    NOT_FOUND,
    CONFLICT
}
