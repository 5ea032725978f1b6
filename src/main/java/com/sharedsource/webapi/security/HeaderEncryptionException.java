package com.sharedsource.webapi.security;

/**
 * Thrown when an authentication header cannot be encrypted with the server key.
 */
public class HeaderEncryptionException extends RuntimeException {

    /**
     * Constructs a new HeaderEncryptionException.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public HeaderEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
