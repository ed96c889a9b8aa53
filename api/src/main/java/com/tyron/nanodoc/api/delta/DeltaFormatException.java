package com.tyron.nanodoc.api.delta;

/**
 * Thrown when a serialized delta cannot be decoded.
 */
public class DeltaFormatException extends RuntimeException {

    public DeltaFormatException(String message) {
        super(message);
    }

    public DeltaFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
