package com.github.stormino.streamcore.exception;

/**
 * Base exception for all adaptive buffering errors.
 */
public class StreamCoreException extends RuntimeException {

    public StreamCoreException(String message) {
        super(message);
    }

    public StreamCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
