package com.sharedsource.webapi.security;

import com.sharedsource.webapi.response.PublicKeyResponse;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;

import javax.crypto.Cipher;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;

/**
 * Header encryption utilities.
 *
 * <p>Authentication headers sent over plain HTTP may be encrypted with an RSA public key
 * <br>obtained from the server {@code getpublickey} action.
 *
 * <p>The server expects the key to be imported from the UTF-8 bytes of the modulus and exponent
 * <br>strings exactly as it sent them, not from their decoded numeric value.
 * <br>Values are encrypted with PKCS#1 v1.5 padding and base64 encoded.
 */
public final class SecurityUtil {

    /**
     * RSA transformation without OAEP.
     */
    static final String TRANSFORMATION = "RSA/ECB/PKCS1Padding";

    /**
     * Private constructor.
     */
    private SecurityUtil() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Encrypts a header value with the server public key.
     *
     * @param value Header value.
     * @param key   Server public key response.
     * @return Base64 encoded cipher text.
     * @throws IllegalArgumentException   If value is blank or key is null.
     * @throws HeaderEncryptionException If the key material is rejected or encryption fails.
     */
    public static String encryptHeaderValue(String value, PublicKeyResponse key) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("value cannot be null or empty when encrypting headers");
        }

        if (key == null) {
            throw new IllegalArgumentException("key cannot be null when encrypting headers");
        }

        return encrypt(value, toPublicKey(key));
    }

    /**
     * Imports the server public key.
     *
     * @param key Server public key response.
     * @return RSAPublicKey instance.
     * @throws IllegalArgumentException   If modulus or exponent are missing.
     * @throws HeaderEncryptionException If the key material is rejected.
     */
    public static RSAPublicKey toPublicKey(PublicKeyResponse key) {
        if (!key.validate()) {
            throw new IllegalArgumentException("key modulus and exponent cannot be null or empty");
        }

        BigInteger modulus = new BigInteger(1, key.getModulus().getBytes(StandardCharsets.UTF_8));
        BigInteger exponent = new BigInteger(1, key.getExponent().getBytes(StandardCharsets.UTF_8));

        try {
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (GeneralSecurityException e) {
            throw new HeaderEncryptionException("Unable to import server public key: " + e.getMessage(), e);
        }
    }

    /**
     * Encrypts a value with an RSA public key.
     *
     * @param value Plain text.
     * @param key   Public key.
     * @return Base64 encoded cipher text.
     * @throws HeaderEncryptionException If encryption fails.
     */
    public static String encrypt(String value, PublicKey key) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key);
            return Base64.encodeBase64String(cipher.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new HeaderEncryptionException("Unable to encrypt header value: " + e.getMessage(), e);
        }
    }
}
