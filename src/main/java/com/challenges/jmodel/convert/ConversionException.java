package com.challenges.jmodel.convert;

/** Thrown when a value has no document representation or cannot be read reflectively. */
public final class ConversionException extends RuntimeException {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
