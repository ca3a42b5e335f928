package com.adlanda.mediphant.exception;

/**
 * Thrown when a request carries a missing or unusable query parameter.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
