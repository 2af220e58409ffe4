package com.starscape.contacts.common.exception;

/**
 * Raised when a write would violate a uniqueness rule, e.g. a second account for the same email.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
