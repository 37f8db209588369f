package com.ricemill.stockkeeper.exception;

/**
 * The actor lacks the capability for the requested operation. The message is for
 * logs only; the web boundary never returns it to the client.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
