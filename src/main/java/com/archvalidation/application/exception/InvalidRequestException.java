package com.archvalidation.application.exception;

/**
 * Request content the service cannot act on: out-of-range paging, an expiry
 * in the past, a model import referencing unknown elements.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
