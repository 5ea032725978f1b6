package com.sharedsource.webapi.response;

import java.time.Duration;

/**
 * Response metadata attached to every executed response.
 *
 * <p>Holds the request URI, the time from send to body read completion and,
 * when the call did not complete normally, the error message and stack trace.
 */
public class ResponseInfo {

    /**
     * How an exchange ended.
     */
    public enum Outcome {
        /**
         * A response was received and its body consumed.
         * <p>The status code may still be a 4xx or 5xx.
         */
        SUCCESS,

        /**
         * A response was received but could not be consumed.
         */
        HTTP_ERROR,

        /**
         * No response was received.
         */
        TRANSPORT_ERROR,

        /**
         * Any other failure while processing the exchange.
         */
        UNEXPECTED_ERROR
    }

    private String uri;
    private Duration responseTime = Duration.ZERO;
    private Outcome outcome = Outcome.SUCCESS;
    private String errorMessage;
    private String stackTrace;

    /**
     * Constructs a new ResponseInfo instance.
     */
    public ResponseInfo() {
    }

    /**
     * Constructs a new ResponseInfo instance.
     *
     * @param uri          Request URI.
     * @param responseTime Response time.
     */
    public ResponseInfo(String uri, Duration responseTime) {
        this.uri = uri;
        this.responseTime = responseTime;
    }

    public String getUri() {
        return uri;
    }

    public ResponseInfo setUri(String uri) {
        this.uri = uri;
        return this;
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public ResponseInfo setResponseTime(Duration responseTime) {
        this.responseTime = responseTime;
        return this;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public ResponseInfo setOutcome(Outcome outcome) {
        this.outcome = outcome;
        return this;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ResponseInfo setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        return this;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public ResponseInfo setStackTrace(String stackTrace) {
        this.stackTrace = stackTrace;
        return this;
    }

    /**
     * Checks if an error was recorded.
     *
     * @return Boolean.
     */
    public boolean hasError() {
        return outcome != Outcome.SUCCESS;
    }

    @Override
    public String toString() {
        return "ResponseInfo{uri='" + uri + "', responseTime=" + responseTime.toMillis() + "ms, outcome=" + outcome +
                (errorMessage != null ? ", errorMessage='" + errorMessage + "'" : "") + "}";
    }
}
