package com.sharedsource.webapi.query;

import okhttp3.HttpUrl;

/**
 * Query capability consumed by data contexts.
 */
public interface BaseQuery {

    /**
     * Item web API base path.
     */
    String API_PATH = "-/item/v1";

    /**
     * Gets query type.
     *
     * @return QueryType.
     */
    QueryType getQueryType();

    /**
     * Gets expected response format.
     *
     * @return ResponseFormat.
     */
    ResponseFormat getResponseFormat();

    /**
     * Builds the target URI.
     *
     * @param hostName Scheme prefixed host name.
     * @return HttpUrl instance.
     */
    HttpUrl buildUri(String hostName);
}
