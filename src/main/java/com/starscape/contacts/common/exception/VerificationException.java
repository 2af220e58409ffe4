package com.starscape.contacts.common.exception;

/**
 * A well-signed verification link that points at no account.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }
}
