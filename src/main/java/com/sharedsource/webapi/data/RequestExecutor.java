package com.sharedsource.webapi.data;

import com.sharedsource.webapi.codec.DeserializationException;
import com.sharedsource.webapi.codec.ResponseDeserializer;
import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.QueryType;
import com.sharedsource.webapi.query.ResponseFormat;
import com.sharedsource.webapi.response.BaseResponse;
import com.sharedsource.webapi.response.ResponseInfo;
import com.sharedsource.webapi.response.ResponseInfo.Outcome;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Request building and execution shared by all data contexts.
 *
 * <p>Contexts compose an executor and extend what it builds, the executor itself knows nothing
 * <br>about authentication.
 *
 * <p>{@link #execute(HttpRequest, ResponseFormat, BaseResponse)} maps every exchange to one of the
 * <br>{@link Outcome} values and never raises for operational failures.
 */
final class RequestExecutor {
    private static final Logger log = LogManager.getLogger(RequestExecutor.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

    /**
     * Client shared by contexts built without an explicit client.
     */
    static final OkHttpClient DEFAULT_CLIENT = newHttpClient(DEFAULT_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS);

    private final String hostName;
    private final OkHttpClient httpClient;
    private final ResponseDeserializer deserializer = new ResponseDeserializer();

    /**
     * Constructs a new RequestExecutor instance.
     *
     * @param hostName   Normalized host name.
     * @param httpClient OkHttpClient instance.
     */
    RequestExecutor(String hostName, OkHttpClient httpClient) {
        this.hostName = hostName;
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    /**
     * Builds an OkHttpClient that never retries.
     *
     * @param connectTimeout Connect timeout in seconds.
     * @param readTimeout    Read and write timeout in seconds.
     * @return OkHttpClient instance.
     */
    static OkHttpClient newHttpClient(int connectTimeout, int readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout, TimeUnit.SECONDS)
                .readTimeout(readTimeout, TimeUnit.SECONDS)
                .writeTimeout(readTimeout, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    String getHostName() {
        return hostName;
    }

    OkHttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * Builds the base request.
     * <p>Persistent connections are disabled.
     *
     * @param uri  Target URI.
     * @param type Query type.
     * @return HttpRequest instance.
     */
    HttpRequest buildRequest(HttpUrl uri, QueryType type) {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(type, "type must not be null");

        return new HttpRequest(uri.toString(), type.toHttpMethod())
                .addHeader("Connection", "close");
    }

    /**
     * Sends a request and binds its response.
     *
     * @param request  Request.
     * @param format   Response format.
     * @param response Empty response.
     * @param <T>      Response type.
     * @return Bound response, or the empty response populated with failure details.
     */
    <T extends BaseResponse> T execute(HttpRequest request, ResponseFormat format, T response) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(format, "responseFormat must not be null");
        Objects.requireNonNull(response, "response must not be null");

        log.debug("Sending request: {}", request);
        StopWatch stopWatch = StopWatch.createStarted();

        try (Response httpResponse = httpClient.newCall(toOkHttpRequest(request)).execute()) {
            String body;
            try {
                ResponseBody responseBody = httpResponse.body();
                body = responseBody != null ? responseBody.string() : "";
            } catch (IOException e) {
                return fail(response, request, stopWatch, Outcome.HTTP_ERROR, httpResponse.code(), httpResponse.message(), e);
            }
            Duration elapsed = elapsed(stopWatch);

            T result;
            try {
                result = deserializer.deserialize(body, format, response);
            } catch (DeserializationException e) {
                if (!httpResponse.isSuccessful()) {
                    return fail(response, request, stopWatch, Outcome.HTTP_ERROR, httpResponse.code(), httpResponse.message(), e);
                }
                return fail(response, request, stopWatch, Outcome.UNEXPECTED_ERROR,
                        HttpURLConnection.HTTP_INTERNAL_ERROR, INTERNAL_SERVER_ERROR, e);
            }

            result.setInfo(new ResponseInfo(request.getUrl(), elapsed));
            // Body status only refines a successful HTTP status.
            if (!httpResponse.isSuccessful() || result.getStatusCode() == 0) {
                result.setStatusCode(httpResponse.code());
            }
            result.setStatusDescription(httpResponse.message());

            log.debug("Received {} from {} in {}ms", httpResponse.code(), request.getUrl(), elapsed.toMillis());
            return result;
        } catch (IOException e) {
            return fail(response, request, stopWatch, Outcome.TRANSPORT_ERROR,
                    HttpURLConnection.HTTP_INTERNAL_ERROR, INTERNAL_SERVER_ERROR, e);
        } catch (RuntimeException e) {
            return fail(response, request, stopWatch, Outcome.UNEXPECTED_ERROR,
                    HttpURLConnection.HTTP_INTERNAL_ERROR, INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * Records a failed exchange on the response.
     *
     * @param response          Response to populate.
     * @param request           Request.
     * @param stopWatch         Running or stopped stop watch.
     * @param outcome           Outcome.
     * @param statusCode        Status code.
     * @param statusDescription Status description.
     * @param e                 Cause.
     * @param <T>               Response type.
     * @return Response.
     */
    private <T extends BaseResponse> T fail(T response, HttpRequest request, StopWatch stopWatch, Outcome outcome,
                                            int statusCode, String statusDescription, Exception e) {
        response.setInfo(new ResponseInfo(request.getUrl(), elapsed(stopWatch))
                .setOutcome(outcome)
                .setErrorMessage(e.getMessage())
                .setStackTrace(ExceptionUtils.getStackTrace(e)));
        response.setStatusCode(statusCode);
        response.setStatusDescription(statusDescription);

        log.warn("Request to {} failed with {} ({}): {}", request.getUrl(), outcome, statusCode, e.getMessage());
        return response;
    }

    private static Duration elapsed(StopWatch stopWatch) {
        if (stopWatch.isStarted()) {
            stopWatch.stop();
        }
        return Duration.ofNanos(stopWatch.getNanoTime());
    }

    /**
     * Converts a request container into an OkHttp request.
     *
     * @param request HttpRequest instance.
     * @return Request instance.
     */
    static Request toOkHttpRequest(HttpRequest request) {
        Request.Builder builder = new Request.Builder().url(request.getUrl());
        request.getHeaders().forEach(builder::header);

        switch (request.getMethod()) {
            case POST:
                builder.post(requestBody(request));
                break;
            case PUT:
                builder.put(requestBody(request));
                break;
            case DELETE:
                builder.delete();
                break;
            case GET:
            default:
                builder.get();
                break;
        }

        return builder.build();
    }

    private static RequestBody requestBody(HttpRequest request) {
        MediaType mediaType = request.getContentType() != null ? MediaType.parse(request.getContentType()) : null;
        return RequestBody.create(request.getContentBytes(), mediaType);
    }
}
