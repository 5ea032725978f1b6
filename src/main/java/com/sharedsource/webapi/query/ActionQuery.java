package com.sharedsource.webapi.query;

import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

/**
 * Server action query, always sent as a read.
 * <p>Targets {@code /-/item/v1/-/actions/{action}}.
 */
public class ActionQuery implements BaseQuery {

    /**
     * Public key action name.
     */
    public static final String GET_PUBLIC_KEY = "getpublickey";

    private final String action;
    private final ResponseFormat responseFormat;

    /**
     * Constructs a new ActionQuery instance expecting JSON.
     *
     * @param action Action name.
     */
    public ActionQuery(String action) {
        this(action, ResponseFormat.JSON);
    }

    /**
     * Constructs a new ActionQuery instance.
     *
     * @param action         Action name.
     * @param responseFormat Response format.
     */
    public ActionQuery(String action, ResponseFormat responseFormat) {
        if (StringUtils.isBlank(action)) {
            throw new IllegalArgumentException("action cannot be null or empty");
        }
        this.action = action;
        this.responseFormat = responseFormat;
    }

    public String getAction() {
        return action;
    }

    @Override
    public QueryType getQueryType() {
        return QueryType.READ;
    }

    @Override
    public ResponseFormat getResponseFormat() {
        return responseFormat;
    }

    @Override
    public HttpUrl buildUri(String hostName) {
        return HttpUrl.get(hostName).newBuilder()
                .addPathSegments(API_PATH)
                .addPathSegment("-")
                .addPathSegment("actions")
                .addPathSegment(action)
                .build();
    }

    @Override
    public String toString() {
        return "ActionQuery{action='" + action + "'}";
    }
}
