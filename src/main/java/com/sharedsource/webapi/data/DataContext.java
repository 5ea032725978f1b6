package com.sharedsource.webapi.data;

import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.BaseQuery;
import com.sharedsource.webapi.query.QueryType;
import com.sharedsource.webapi.query.ResponseFormat;
import com.sharedsource.webapi.response.BaseResponse;
import com.sharedsource.webapi.response.PublicKeyResponse;
import okhttp3.HttpUrl;

import java.util.function.Supplier;

/**
 * Connection to one item web API host.
 *
 * <p>A context is built once per host and reused for many queries.
 * <br>Its host name is fixed at construction, build a new context to target another host.
 *
 * <p>Operational failures (network errors, error statuses, unreadable bodies) never raise.
 * <br>They are recorded on the returned response status and {@link com.sharedsource.webapi.response.ResponseInfo}.
 */
public interface DataContext {

    /**
     * Gets scheme prefixed host name.
     *
     * @return String.
     */
    String getHostName();

    /**
     * Checks if the context talks https.
     *
     * @return Boolean.
     */
    boolean isSecure();

    /**
     * Builds a request for the given URI and query type.
     *
     * @param uri  Target URI.
     * @param type Query type.
     * @return HttpRequest instance.
     */
    HttpRequest buildRequest(HttpUrl uri, QueryType type);

    /**
     * Runs a query.
     *
     * @param query           Query.
     * @param responseFactory Creates the empty response the result is bound to.
     * @param <T>             Response type.
     * @return Response, never null.
     */
    <T extends BaseResponse> T getResponse(BaseQuery query, Supplier<T> responseFactory);

    /**
     * Sends a request and binds its response.
     *
     * @param request        Request.
     * @param responseFormat Response format.
     * @param response       Empty response, returned as is for blank bodies and failures.
     * @param <T>            Response type.
     * @return Response, never null.
     */
    <T extends BaseResponse> T execute(HttpRequest request, ResponseFormat responseFormat, T response);

    /**
     * Gets the server public key.
     *
     * @return PublicKeyResponse or null if the server did not provide a valid key.
     */
    PublicKeyResponse getPublicKey();
}
