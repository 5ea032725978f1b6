package com.sharedsource.webapi.credentials;

import org.apache.commons.lang3.StringUtils;

/**
 * User name and password credentials for the item web API.
 */
public class WebApiCredentials implements Credentials {

    private final String userName;
    private final String password;
    private final boolean encryptHeaders;
    private String errorMessage;

    /**
     * Constructs a new WebApiCredentials instance sending plaintext headers.
     *
     * @param userName User name, usually domain qualified like {@code sitecore\admin}.
     * @param password Password.
     */
    public WebApiCredentials(String userName, String password) {
        this(userName, password, false);
    }

    /**
     * Constructs a new WebApiCredentials instance.
     *
     * @param userName       User name, usually domain qualified like {@code sitecore\admin}.
     * @param password       Password.
     * @param encryptHeaders Encrypt headers with the server public key.
     */
    public WebApiCredentials(String userName, String password, boolean encryptHeaders) {
        this.userName = userName;
        this.password = password;
        this.encryptHeaders = encryptHeaders;
    }

    @Override
    public String getUserName() {
        return userName;
    }

    @Override
    public String getPassword() {
        return password;
    }

    @Override
    public boolean isEncryptHeaders() {
        return encryptHeaders;
    }

    @Override
    public boolean validate() {
        if (StringUtils.isBlank(userName)) {
            errorMessage = "userName cannot be null or empty";
            return false;
        }

        if (StringUtils.isBlank(password)) {
            errorMessage = "password cannot be null or empty";
            return false;
        }

        errorMessage = null;
        return true;
    }

    @Override
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "WebApiCredentials{userName='" + userName + "', encryptHeaders=" + encryptHeaders + "}";
    }
}
