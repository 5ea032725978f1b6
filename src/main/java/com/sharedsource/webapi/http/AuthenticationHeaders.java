package com.sharedsource.webapi.http;

import java.util.List;

/**
 * Custom authentication header names understood by the item web API.
 * <p>These names are part of the wire contract with the server and must not change.
 */
public final class AuthenticationHeaders {

    /**
     * User name header.
     */
    public static final String USER_NAME = "X-Scitemwebapi-Username";

    /**
     * Password header.
     */
    public static final String PASSWORD = "X-Scitemwebapi-Password";

    /**
     * Encrypted flag header.
     * <p>Set to {@link #ENCRYPTED_VALUE} when the user name and password headers carry ciphertext.
     */
    public static final String ENCRYPTED = "X-Scitemwebapi-Encrypted";

    /**
     * Encrypted flag header value.
     */
    public static final String ENCRYPTED_VALUE = "1";

    /**
     * All authentication headers.
     */
    public static final List<String> ALL = List.of(USER_NAME, PASSWORD, ENCRYPTED);

    /**
     * Private constructor.
     */
    private AuthenticationHeaders() {
        throw new IllegalStateException("Static class");
    }
}
