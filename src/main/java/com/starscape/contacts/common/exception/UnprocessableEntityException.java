package com.starscape.contacts.common.exception;

/**
 * Well-formed input that fails a rule spanning several fields.
 */
public class UnprocessableEntityException extends RuntimeException {

    public UnprocessableEntityException(String message) {
        super(message);
    }
}
