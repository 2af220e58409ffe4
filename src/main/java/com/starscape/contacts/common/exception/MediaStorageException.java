package com.starscape.contacts.common.exception;

/**
 * The external media host rejected or failed an avatar operation.
 */
public class MediaStorageException extends RuntimeException {

    public MediaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
