package com.sharedsource.webapi.http;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Item web API request container.
 *
 * <p>This class is a lightweight mutable container holding the pieces required
 * to perform one API call. Data contexts build it and then hand it to the
 * transport for execution.
 *
 * <p>Behavior summary:
 * <ul>
 *   <li>The URL is immutable after construction.</li>
 *   <li>The request method defaults to {@code GET} unless supplied otherwise.</li>
 *   <li>Headers are stored in insertion order and can be added with the fluent
 *       {@code addHeader} helper.</li>
 *   <li>Textual content is stored in {@link #content} as a {@code Pair<String, String>}:
 *       value and MIME type. It is sent UTF-8 encoded.</li>
 *   <li>The class is mutable and NOT thread-safe. Create a new instance per request.</li>
 * </ul>
 *
 * <p>Note: {@link #toString()} masks the authentication headers to avoid leaking
 * credentials in logs.
 */
public class HttpRequest {

    /**
     * Request URL (immutable after construction).
     */
    private final String url;

    /**
     * Request method. Default is GET.
     */
    private HttpMethod method = HttpMethod.GET;

    /**
     * Headers container. Mutable map of header-name -> header-value.
     */
    private final Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Content MIME type, may be set without content.
     */
    private String contentType;

    /**
     * Textual content container. Pair<contentString, mimeType>.
     */
    private Pair<String, String> content;

    /**
     * Constructs a new HttpRequest instance with given URL and request method.
     *
     * @param url    Request URL.
     * @param method Request method.
     */
    public HttpRequest(String url, HttpMethod method) {
        this(url);
        this.method = method;
    }

    /**
     * Constructs a new HttpRequest instance with given URL.
     *
     * @param url Request URL.
     */
    public HttpRequest(String url) {
        this.url = url;
    }

    /**
     * Gets request URL.
     *
     * @return String.
     */
    public String getUrl() {
        return url;
    }

    /**
     * Gets request method.
     *
     * @return Instance of HttpMethod.
     */
    public HttpMethod getMethod() {
        return method;
    }

    /**
     * Gets request headers.
     *
     * @return Map of String, String.
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Gets request header value.
     *
     * @param name Header name.
     * @return String or null if not set.
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * Adds request header.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public HttpRequest addHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Gets content MIME type.
     *
     * @return String or null if not set.
     */
    public String getContentType() {
        return content != null ? content.getRight() : contentType;
    }

    /**
     * Sets content MIME type.
     *
     * @param contentType Content MIME type.
     * @return Self.
     */
    public HttpRequest setContentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    /**
     * Gets request content.
     *
     * @return Pair of String, String.
     */
    public Pair<String, String> getContent() {
        return content;
    }

    /**
     * Adds request content.
     *
     * @param content Content string.
     * @param type    Content MIME type.
     * @return Self.
     */
    public HttpRequest addContent(String content, String type) {
        this.content = new ImmutablePair<>(content, type);
        this.contentType = type;
        return this;
    }

    /**
     * Gets content bytes as sent on the wire.
     *
     * @return Byte array, empty if no content.
     */
    public byte[] getContentBytes() {
        return content != null && content.getLeft() != null
                ? content.getLeft().getBytes(StandardCharsets.UTF_8)
                : new byte[0];
    }

    /**
     * Gets content length in bytes.
     *
     * @return Long.
     */
    public long getContentLength() {
        return getContentBytes().length;
    }

    /**
     * Returns a string representation of the contents.
     *
     * @return Request string.
     */
    @Override
    public String toString() {
        Map<String, String> safeHeaders = headers.entrySet()
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        entry -> AuthenticationHeaders.ALL.contains(entry.getKey()) ? "*****" : entry.getValue(),
                        (a, b) -> b,
                        LinkedHashMap::new));

        return Collections.singletonList(Stream.of(
                new AbstractMap.SimpleEntry<>("method", method),
                new AbstractMap.SimpleEntry<>("url", url),
                new AbstractMap.SimpleEntry<>("headers", safeHeaders),
                new AbstractMap.SimpleEntry<>("contentLength", getContentLength())
        ).collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue))).toString();
    }
}
