package com.flowsmith.core.support;

/**
 * The request is missing something it needs. Never retried.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
