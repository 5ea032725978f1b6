package com.sharedsource.webapi.data;

import com.sharedsource.webapi.config.ContextConfig;
import com.sharedsource.webapi.credentials.WebApiCredentials;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;

/**
 * Factory for creating data contexts from configuration.
 *
 * <p>Example usage:
 * <pre>
 * DataContext context = DataContextFactory.createFromFile("cfg/context.json5");
 * ItemResponse response = context.getResponse(query, ItemResponse::new);
 * </pre>
 */
public class DataContextFactory {
    private static final Logger log = LogManager.getLogger(DataContextFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private DataContextFactory() {
        // Utility class
    }

    /**
     * Creates a data context from a configuration file.
     *
     * @param path Path to configuration file.
     * @return DataContext instance.
     * @throws IOException Unable to read file.
     */
    public static DataContext createFromFile(String path) throws IOException {
        return createFromConfig(new ContextConfig(path));
    }

    /**
     * Creates a data context from configuration.
     * <p>Authenticated when credentials are configured.
     *
     * @param config ContextConfig instance.
     * @return DataContext instance.
     * @throws IllegalArgumentException If the host or credentials are invalid.
     * @throws IllegalStateException    If encrypted headers are requested over https.
     */
    public static DataContext createFromConfig(ContextConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        OkHttpClient httpClient = httpClient(config);

        if (config.hasCredentials()) {
            WebApiCredentials credentials = config.getCredentials();
            AuthenticatedWebApiDataContext context =
                    new AuthenticatedWebApiDataContext(config.getHost(), credentials, config.isSecure(), httpClient);

            log.info("Created authenticated data context for {} (encrypted headers: {})",
                    context.getHostName(), credentials.isEncryptHeaders());
            return context;
        }

        WebApiDataContext context = new WebApiDataContext(config.getHost(), config.isSecure(), httpClient);
        log.info("Created anonymous data context for {}", context.getHostName());
        return context;
    }

    /**
     * Gets a client for the configured timeouts, the shared one when defaults apply.
     *
     * @param config ContextConfig instance.
     * @return OkHttpClient instance.
     */
    private static OkHttpClient httpClient(ContextConfig config) {
        if (config.getConnectTimeout() == RequestExecutor.DEFAULT_TIMEOUT_SECONDS &&
                config.getReadTimeout() == RequestExecutor.DEFAULT_TIMEOUT_SECONDS) {
            return RequestExecutor.DEFAULT_CLIENT;
        }

        return RequestExecutor.newHttpClient(config.getConnectTimeout(), config.getReadTimeout());
    }
}
