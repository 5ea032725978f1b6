package com.sharedsource.webapi.query;

import com.sharedsource.webapi.http.HttpMethod;

/**
 * Item web API query types and the HTTP method each one is sent with.
 */
public enum QueryType {
    READ(HttpMethod.GET),
    CREATE(HttpMethod.POST),
    UPDATE(HttpMethod.PUT),
    DELETE(HttpMethod.DELETE);

    private final HttpMethod method;

    QueryType(HttpMethod method) {
        this.method = method;
    }

    /**
     * Gets the HTTP method for this query type.
     *
     * @return HttpMethod.
     */
    public HttpMethod toHttpMethod() {
        return method;
    }

    /**
     * Checks if this query type writes item fields.
     * <p>Such queries need an authenticated data context and carry a form body.
     *
     * @return Boolean.
     */
    public boolean isMutating() {
        return this == CREATE || this == UPDATE;
    }
}
