package com.starscape.contacts.common.exception;

/**
 * A token embedded in an emailed link (verification or password reset) was malformed,
 * expired, of the wrong kind, or already used.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
