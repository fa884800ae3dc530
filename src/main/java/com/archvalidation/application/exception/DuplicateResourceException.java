package com.archvalidation.application.exception;

/**
 * A resource with the same natural key already exists.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
