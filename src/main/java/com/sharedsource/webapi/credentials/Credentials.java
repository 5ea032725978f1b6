package com.sharedsource.webapi.credentials;

/**
 * Credentials used by an authenticated data context.
 */
public interface Credentials {

    /**
     * Gets user name.
     *
     * @return String.
     */
    String getUserName();

    /**
     * Gets password.
     *
     * @return String.
     */
    String getPassword();

    /**
     * Checks if the authentication headers should be encrypted with the server public key.
     *
     * @return Boolean.
     */
    boolean isEncryptHeaders();

    /**
     * Validates the credentials.
     * <p>On failure {@link #getErrorMessage()} describes the problem.
     *
     * @return Boolean.
     */
    boolean validate();

    /**
     * Gets the last validation error message.
     *
     * @return String or null if valid or not yet validated.
     */
    String getErrorMessage();
}
