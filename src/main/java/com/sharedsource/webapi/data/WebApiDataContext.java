package com.sharedsource.webapi.data;

import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.ActionQuery;
import com.sharedsource.webapi.query.BaseQuery;
import com.sharedsource.webapi.query.QueryType;
import com.sharedsource.webapi.query.ResponseFormat;
import com.sharedsource.webapi.response.BaseResponse;
import com.sharedsource.webapi.response.PublicKeyResponse;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Unauthenticated data context.
 *
 * <p>Runs read and delete queries anonymously. Create and update queries are rejected.
 *
 * <p>Example usage:
 * <pre>
 * DataContext context = new WebApiDataContext("cms.example.com");
 * ItemResponse response = context.getResponse(query, ItemResponse::new);
 *
 * if (!response.isSuccess()) {
 *     log.warn("Query failed: {} {}", response.getStatusCode(), response.getInfo().getErrorMessage());
 * }
 * </pre>
 */
public class WebApiDataContext implements DataContext {
    private static final Logger log = LogManager.getLogger(WebApiDataContext.class);

    private final RequestExecutor executor;

    /**
     * Constructs a new WebApiDataContext instance over http.
     *
     * @param hostName Host name, with or without scheme.
     */
    public WebApiDataContext(String hostName) {
        this(hostName, false);
    }

    /**
     * Constructs a new WebApiDataContext instance.
     *
     * @param hostName Host name, with or without scheme.
     * @param secure   Use https.
     */
    public WebApiDataContext(String hostName, boolean secure) {
        this(hostName, secure, RequestExecutor.DEFAULT_CLIENT);
    }

    /**
     * Constructs a new WebApiDataContext instance.
     *
     * @param hostName   Host name, with or without scheme.
     * @param secure     Use https.
     * @param httpClient OkHttpClient instance.
     * @throws IllegalArgumentException If the host name is not recognized.
     */
    public WebApiDataContext(String hostName, boolean secure, OkHttpClient httpClient) {
        this.executor = new RequestExecutor(HostNames.normalize(hostName, secure), httpClient);
    }

    @Override
    public String getHostName() {
        return executor.getHostName();
    }

    @Override
    public boolean isSecure() {
        return HostNames.isSecure(getHostName());
    }

    @Override
    public HttpRequest buildRequest(HttpUrl uri, QueryType type) {
        return executor.buildRequest(uri, type);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException If the query creates or updates items.
     */
    @Override
    public <T extends BaseResponse> T getResponse(BaseQuery query, Supplier<T> responseFactory) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(responseFactory, "responseFactory must not be null");

        if (query.getQueryType().isMutating()) {
            throw new IllegalStateException("A create or update query must be used with an authenticated data context");
        }

        HttpRequest request = buildRequest(query.buildUri(getHostName()), query.getQueryType());
        return execute(request, query.getResponseFormat(), responseFactory.get());
    }

    @Override
    public <T extends BaseResponse> T execute(HttpRequest request, ResponseFormat responseFormat, T response) {
        return executor.execute(request, responseFormat, response);
    }

    @Override
    public PublicKeyResponse getPublicKey() {
        PublicKeyResponse response = getResponse(new ActionQuery(ActionQuery.GET_PUBLIC_KEY), PublicKeyResponse::new);

        if (!response.validate()) {
            log.warn("No valid public key from {}, status {}", getHostName(), response.getStatusCode());
            return null;
        }

        return response;
    }

    /**
     * Gets the underlying client.
     *
     * @return OkHttpClient instance.
     */
    OkHttpClient getHttpClient() {
        return executor.getHttpClient();
    }

    @Override
    public String toString() {
        return "WebApiDataContext{hostName='" + getHostName() + "'}";
    }
}
