package com.sharedsource.webapi.codec;

/**
 * Thrown when a response body cannot be bound to its response type.
 */
public class DeserializationException extends Exception {

    /**
     * Constructs a new DeserializationException.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
