package com.sharedsource.webapi.http;

/**
 * HTTP request methods used by the item web API.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE;

    /**
     * Checks if requests with this method carry a form body.
     *
     * @return Boolean.
     */
    public boolean hasBody() {
        return this == POST || this == PUT;
    }
}
