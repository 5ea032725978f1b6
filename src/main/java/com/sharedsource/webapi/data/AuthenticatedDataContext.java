package com.sharedsource.webapi.data;

import com.sharedsource.webapi.credentials.Credentials;
import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.QueryType;
import okhttp3.HttpUrl;

/**
 * Data context sending credentials with every request.
 * <p>Required for create and update queries.
 */
public interface AuthenticatedDataContext extends DataContext {

    /**
     * Gets credentials.
     *
     * @return Credentials.
     */
    Credentials getCredentials();

    /**
     * Adds the authentication headers, encrypted if the credentials ask for it.
     *
     * @param request Request.
     */
    void applyHeaders(HttpRequest request);

    /**
     * Adds the authentication headers encrypted with the server public key.
     *
     * @param request Request.
     */
    void applyEncryptedHeaders(HttpRequest request);

    /**
     * Builds a request carrying a form body.
     *
     * @param uri  Target URI.
     * @param type Query type.
     * @param body Form url encoded body.
     * @return HttpRequest instance.
     */
    HttpRequest buildRequest(HttpUrl uri, QueryType type, String body);
}
