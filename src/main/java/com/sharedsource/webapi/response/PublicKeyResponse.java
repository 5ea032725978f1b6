package com.sharedsource.webapi.response;

import com.google.gson.annotations.SerializedName;
import org.apache.commons.lang3.StringUtils;

/**
 * Server RSA public key as returned by the {@code getpublickey} action.
 *
 * <p>Modulus and exponent are kept exactly as the server sent them.
 * <br>They are used once to encrypt authentication headers and then discarded.
 */
public class PublicKeyResponse extends AbstractResponse {

    @SerializedName(value = "modulus", alternate = {"Modulus"})
    private String modulus;

    @SerializedName(value = "exponent", alternate = {"Exponent"})
    private String exponent;

    /**
     * Constructs a new PublicKeyResponse instance.
     */
    public PublicKeyResponse() {
    }

    /**
     * Constructs a new PublicKeyResponse instance.
     *
     * @param modulus  Modulus string.
     * @param exponent Exponent string.
     */
    public PublicKeyResponse(String modulus, String exponent) {
        this.modulus = modulus;
        this.exponent = exponent;
    }

    public String getModulus() {
        return modulus;
    }

    public String getExponent() {
        return exponent;
    }

    /**
     * Checks the key material is present.
     *
     * @return Boolean.
     */
    public boolean validate() {
        return StringUtils.isNotBlank(modulus) && StringUtils.isNotBlank(exponent);
    }
}
