package com.ricemill.stockkeeper.exception;

/**
 * A metric could not be derived from the stored rows. Fatal for the request; a
 * metric is never defaulted to zero in its place.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }
}
