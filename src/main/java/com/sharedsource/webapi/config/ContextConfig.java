package com.sharedsource.webapi.config;

import com.sharedsource.webapi.credentials.WebApiCredentials;

import java.io.IOException;
import java.util.Map;

/**
 * Data context configuration.
 *
 * <p>This class provides type safe access to the host, transport and credentials of one context.
 *
 * <p>Example file:
 * <pre>
 * {
 *   host: "cms.example.com",
 *   secure: false,
 *   connectTimeout: 10,
 *   credentials: {
 *     username: "sitecore\\admin",
 *     password: "b",
 *     encryptHeaders: true
 *   }
 * }
 * </pre>
 */
public class ContextConfig extends ConfigFoundation {

    /**
     * Constructs a new ContextConfig instance.
     *
     * @param map Configuration map.
     */
    public ContextConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ContextConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ContextConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets host name.
     *
     * @return Host name, with or without scheme.
     */
    public String getHost() {
        return getStringProperty("host", "");
    }

    /**
     * Checks if https should be used.
     *
     * @return Boolean.
     */
    public boolean isSecure() {
        return getBooleanProperty("secure", false);
    }

    /**
     * Gets connection timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getConnectTimeout() {
        return Math.toIntExact(getLongProperty("connectTimeout", 30L));
    }

    /**
     * Gets read timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getReadTimeout() {
        return Math.toIntExact(getLongProperty("readTimeout", 30L));
    }

    /**
     * Checks if credentials are configured.
     *
     * @return Boolean.
     */
    public boolean hasCredentials() {
        return !getMapProperty("credentials").isEmpty();
    }

    /**
     * Gets credentials.
     *
     * @return WebApiCredentials instance or null if none configured.
     */
    public WebApiCredentials getCredentials() {
        if (!hasCredentials()) {
            return null;
        }

        return new WebApiCredentials(
                getStringProperty("credentials.username", ""),
                getStringProperty("credentials.password", ""),
                getBooleanProperty("credentials.encryptHeaders", false));
    }
}
