package com.ricemill.stockkeeper.exception;

/**
 * A store read kept failing after its retry. Lets one dashboard widget fail
 * without taking the others down.
 */
public class DegradedDataException extends RuntimeException {

    public DegradedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
