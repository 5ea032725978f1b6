package com.sharedsource.webapi.data;

import com.sharedsource.webapi.credentials.Credentials;
import com.sharedsource.webapi.http.AuthenticationHeaders;
import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.BaseQuery;
import com.sharedsource.webapi.query.QueryType;
import com.sharedsource.webapi.query.ResponseFormat;
import com.sharedsource.webapi.query.UpdatableQuery;
import com.sharedsource.webapi.response.BaseResponse;
import com.sharedsource.webapi.response.PublicKeyResponse;
import com.sharedsource.webapi.security.SecurityUtil;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Authenticated data context.
 *
 * <p>Sends the credentials as custom headers on every request.
 * <br>Over plain http the headers may be encrypted with the server public key, which this context
 * <br>fetches anonymously before each encrypted request.
 * <br>Over https the server protects the headers itself and encryption is refused.
 *
 * <p>Example usage:
 * <pre>
 * Credentials credentials = new WebApiCredentials("sitecore\\admin", "b", true);
 * AuthenticatedDataContext context = new AuthenticatedWebApiDataContext("cms.example.com", credentials);
 *
 * ItemQuery query = new ItemQuery.Builder()
 *     .withType(QueryType.UPDATE)
 *     .withPath("/sitecore/content/Home")
 *     .withField("Title", "Welcome")
 *     .build();
 *
 * ItemResponse response = context.getResponse(query, ItemResponse::new);
 * </pre>
 */
public class AuthenticatedWebApiDataContext implements AuthenticatedDataContext {
    private static final Logger log = LogManager.getLogger(AuthenticatedWebApiDataContext.class);

    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private final RequestExecutor executor;
    private final Credentials credentials;

    /**
     * Constructs a new AuthenticatedWebApiDataContext instance over http.
     *
     * @param hostName    Host name, with or without scheme.
     * @param credentials Credentials.
     */
    public AuthenticatedWebApiDataContext(String hostName, Credentials credentials) {
        this(hostName, credentials, false);
    }

    /**
     * Constructs a new AuthenticatedWebApiDataContext instance.
     *
     * @param hostName    Host name, with or without scheme.
     * @param credentials Credentials.
     * @param secure      Use https.
     */
    public AuthenticatedWebApiDataContext(String hostName, Credentials credentials, boolean secure) {
        this(hostName, credentials, secure, RequestExecutor.DEFAULT_CLIENT);
    }

    /**
     * Constructs a new AuthenticatedWebApiDataContext instance.
     *
     * @param hostName    Host name, with or without scheme.
     * @param credentials Credentials.
     * @param secure      Use https.
     * @param httpClient  OkHttpClient instance.
     * @throws IllegalArgumentException If the host name is not recognized or the credentials are invalid.
     * @throws IllegalStateException    If encrypted headers are requested over https.
     */
    public AuthenticatedWebApiDataContext(String hostName, Credentials credentials, boolean secure, OkHttpClient httpClient) {
        Objects.requireNonNull(credentials, "credentials cannot be null when creating an authenticated data context");
        String normalized = HostNames.normalize(hostName, secure);

        if (HostNames.isSecure(normalized) && credentials.isEncryptHeaders()) {
            throw new IllegalStateException("If you use an SSL connection, the credentials must not be encrypted. " +
                    "The server takes care of header encryption.");
        }

        if (!credentials.validate()) {
            throw new IllegalArgumentException(credentials.getErrorMessage());
        }

        this.credentials = credentials;
        this.executor = new RequestExecutor(normalized, httpClient);
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
    public Credentials getCredentials() {
        return credentials;
    }

    @Override
    public void applyHeaders(HttpRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        if (credentials.isEncryptHeaders()) {
            applyEncryptedHeaders(request);
            return;
        }

        request.addHeader(AuthenticationHeaders.USER_NAME, credentials.getUserName());
        request.addHeader(AuthenticationHeaders.PASSWORD, credentials.getPassword());
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException If the server did not provide a valid public key.
     */
    @Override
    public void applyEncryptedHeaders(HttpRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        PublicKeyResponse key = getPublicKey();
        if (key == null) {
            log.warn("Unable to encrypt headers for {}, no public key available", getHostName());
        }

        request.addHeader(AuthenticationHeaders.USER_NAME, SecurityUtil.encryptHeaderValue(credentials.getUserName(), key));
        request.addHeader(AuthenticationHeaders.PASSWORD, SecurityUtil.encryptHeaderValue(credentials.getPassword(), key));
        request.addHeader(AuthenticationHeaders.ENCRYPTED, AuthenticationHeaders.ENCRYPTED_VALUE);
    }

    @Override
    public HttpRequest buildRequest(HttpUrl uri, QueryType type) {
        HttpRequest request = executor.buildRequest(uri, type);

        applyHeaders(request);

        if (request.getMethod().hasBody()) {
            request.setContentType(FORM_URLENCODED);
        }

        return request;
    }

    @Override
    public HttpRequest buildRequest(HttpUrl uri, QueryType type, String body) {
        HttpRequest request = buildRequest(uri, type);
        String contentType = request.getContentType() != null ? request.getContentType() : FORM_URLENCODED;
        return request.addContent(body != null ? body : "", contentType);
    }

    @Override
    public <T extends BaseResponse> T getResponse(BaseQuery query, Supplier<T> responseFactory) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(responseFactory, "responseFactory must not be null");

        HttpUrl uri = query.buildUri(getHostName());
        HttpRequest request;

        if (query.getQueryType().isMutating()) {
            if (!(query instanceof UpdatableQuery)) {
                throw new IllegalArgumentException("A create or update query must provide fields to update");
            }
            String body = ((UpdatableQuery) query).getFieldsToUpdate().toQueryString();
            request = buildRequest(uri, query.getQueryType(), body);
        } else {
            request = buildRequest(uri, query.getQueryType());
        }

        return execute(request, query.getResponseFormat(), responseFactory.get());
    }

    @Override
    public <T extends BaseResponse> T execute(HttpRequest request, ResponseFormat responseFormat, T response) {
        return executor.execute(request, responseFormat, response);
    }

    /**
     * Gets the server public key through a separate unauthenticated context.
     * <p>Authenticating this call would need the public key again and never terminate.
     *
     * @return PublicKeyResponse or null if the server did not provide a valid key.
     */
    @Override
    public PublicKeyResponse getPublicKey() {
        return new WebApiDataContext(getHostName(), isSecure(), executor.getHttpClient()).getPublicKey();
    }

    @Override
    public String toString() {
        return "AuthenticatedWebApiDataContext{hostName='" + getHostName() + "', credentials=" + credentials + "}";
    }
}
