package com.sharedsource.webapi.data;

import com.sharedsource.webapi.credentials.WebApiCredentials;
import com.sharedsource.webapi.http.AuthenticationHeaders;
import com.sharedsource.webapi.http.HttpRequest;
import com.sharedsource.webapi.query.BaseQuery;
import com.sharedsource.webapi.query.ItemQuery;
import com.sharedsource.webapi.query.QueryType;
import com.sharedsource.webapi.query.ResponseFormat;
import com.sharedsource.webapi.response.ItemResponse;
import com.sharedsource.webapi.response.PublicKeyResponse;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AuthenticatedWebApiDataContext.
 * <p>
 * These tests use MockWebServer to simulate the item web API and its public key action.
 */
class AuthenticatedWebApiDataContextTest {

    static final String USER_NAME = "sitecore\\admin";
    static final String PASSWORD = "b";

    // 128 ASCII characters, imported by the server convention as a 1024 bit modulus.
    static final String PUBLIC_KEY_JSON = "{\"modulus\":\"" +
            "wJ3kTz8QbV1nLmP4sXcR7yHa2eUfGdK9oWiN6tBqZ5jMvC0lYuSxE8rAhD3gFpIk" +
            "Qn7sLz2VbT9cX4mRa1yWe6UjHd5GoKf0iPtN8qBlZ3vMu7JxCrS4gEaY2hDkFw9O" +
            "\",\"exponent\":\"AQAB\"}";

    static final String OK_JSON = "{\"statusCode\":200,\"result\":{\"count\":1}}";

    private MockWebServer mockWebServer;
    private String host;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        host = "localhost:" + mockWebServer.getPort();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private AuthenticatedWebApiDataContext plainContext() {
        return new AuthenticatedWebApiDataContext(host, new WebApiCredentials(USER_NAME, PASSWORD));
    }

    private AuthenticatedWebApiDataContext encryptedContext() {
        return new AuthenticatedWebApiDataContext(host, new WebApiCredentials(USER_NAME, PASSWORD, true));
    }

    @Test
    void testSecureWithEncryptedHeaders() {
        WebApiCredentials credentials = new WebApiCredentials(USER_NAME, PASSWORD, true);

        assertThrows(IllegalStateException.class,
                () -> new AuthenticatedWebApiDataContext("cms.example.com", credentials, true));
        assertThrows(IllegalStateException.class,
                () -> new AuthenticatedWebApiDataContext("https://cms.example.com", credentials));
    }

    @Test
    void testSecureWithPlainHeaders() {
        AuthenticatedWebApiDataContext context =
                new AuthenticatedWebApiDataContext("cms.example.com", new WebApiCredentials(USER_NAME, PASSWORD), true);

        assertTrue(context.isSecure());
        assertEquals("https://cms.example.com", context.getHostName());
    }

    @Test
    void testInvalidCredentials() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new AuthenticatedWebApiDataContext(host, new WebApiCredentials(USER_NAME, "")));

        assertEquals("password cannot be null or empty", e.getMessage());
        assertThrows(NullPointerException.class, () -> new AuthenticatedWebApiDataContext(host, null));
    }

    @Test
    void testPlainHeaders() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody(OK_JSON));

        ItemQuery query = new ItemQuery.Builder().withPath("/sitecore/content/Home").build();
        ItemResponse response = plainContext().getResponse(query, ItemResponse::new);

        assertTrue(response.isSuccess());
        assertEquals(1, response.getResult().getCount());

        RecordedRequest recorded = mockWebServer.takeRequest();
        assertEquals("GET", recorded.getMethod());
        assertEquals(USER_NAME, recorded.getHeader(AuthenticationHeaders.USER_NAME));
        assertEquals(PASSWORD, recorded.getHeader(AuthenticationHeaders.PASSWORD));
        assertNull(recorded.getHeader(AuthenticationHeaders.ENCRYPTED));
        assertEquals(1, mockWebServer.getRequestCount());
    }

    @Test
    void testEncryptedHeaders() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody(PUBLIC_KEY_JSON));
        mockWebServer.enqueue(new MockResponse().setBody(OK_JSON));

        ItemQuery query = new ItemQuery.Builder().withPath("/sitecore/content/Home").build();
        ItemResponse response = encryptedContext().getResponse(query, ItemResponse::new);

        assertTrue(response.isSuccess());
        assertEquals(2, mockWebServer.getRequestCount());

        RecordedRequest keyRequest = mockWebServer.takeRequest();
        assertEquals("/-/item/v1/-/actions/getpublickey", keyRequest.getPath());
        for (String header : AuthenticationHeaders.ALL) {
            assertNull(keyRequest.getHeader(header));
        }

        RecordedRequest itemRequest = mockWebServer.takeRequest();
        String userName = itemRequest.getHeader(AuthenticationHeaders.USER_NAME);
        String password = itemRequest.getHeader(AuthenticationHeaders.PASSWORD);

        assertNotNull(userName);
        assertNotEquals(USER_NAME, userName);
        assertTrue(Base64.isBase64(userName));
        assertEquals(128, Base64.decodeBase64(userName).length);
        assertNotEquals(PASSWORD, password);
        assertEquals(AuthenticationHeaders.ENCRYPTED_VALUE, itemRequest.getHeader(AuthenticationHeaders.ENCRYPTED));
    }

    @Test
    void testEncryptedHeadersWithoutPublicKey() {
        mockWebServer.enqueue(new MockResponse().setBody("{\"modulus\":\"\",\"exponent\":\"AQAB\"}"));

        ItemQuery query = new ItemQuery.Builder().withPath("/sitecore/content/Home").build();
        AuthenticatedWebApiDataContext context = encryptedContext();

        assertThrows(IllegalArgumentException.class, () -> context.getResponse(query, ItemResponse::new));
        assertEquals(1, mockWebServer.getRequestCount());
    }

    @Test
    void testPublicKeyIsAnonymous() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody(PUBLIC_KEY_JSON));

        PublicKeyResponse key = plainContext().getPublicKey();

        assertNotNull(key);
        assertEquals("AQAB", key.getExponent());

        RecordedRequest recorded = mockWebServer.takeRequest();
        for (String header : AuthenticationHeaders.ALL) {
            assertNull(recorded.getHeader(header));
        }
    }

    @Test
    void testCreate() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody(OK_JSON));

        ItemQuery query = new ItemQuery.Builder()
                .withType(QueryType.CREATE)
                .withPath("/sitecore/content/Home")
                .withName("News")
                .withTemplate("Sample/Sample Item")
                .withField("Title", "Welcome")
                .withField("Text", "a&b")
                .build();

        ItemResponse response = plainContext().getResponse(query, ItemResponse::new);

        assertTrue(response.isSuccess());

        RecordedRequest recorded = mockWebServer.takeRequest();
        assertEquals("POST", recorded.getMethod());
        assertEquals("News", recorded.getRequestUrl().queryParameter("name"));
        assertEquals("Sample/Sample Item", recorded.getRequestUrl().queryParameter("template"));
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
        assertEquals("Title=Welcome&Text=a%26b", recorded.getBody().readUtf8());
        assertEquals(USER_NAME, recorded.getHeader(AuthenticationHeaders.USER_NAME));
    }

    @Test
    void testUpdate() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody(OK_JSON));

        ItemQuery query = new ItemQuery.Builder()
                .withType(QueryType.UPDATE)
                .withItemId("{110D559F-DEA5-42EA-9C1C-8A5DF7E70EF9}")
                .withField("Title", "Welcome")
                .build();

        plainContext().getResponse(query, ItemResponse::new);

        RecordedRequest recorded = mockWebServer.takeRequest();
        assertEquals("PUT", recorded.getMethod());
        assertEquals("{110D559F-DEA5-42EA-9C1C-8A5DF7E70EF9}", recorded.getRequestUrl().queryParameter("sc_itemid"));
        assertEquals("Title=Welcome", recorded.getBody().readUtf8());
    }

    @Test
    void testMutatingQueryWithoutFields() {
        BaseQuery query = new BaseQuery() {
            @Override
            public QueryType getQueryType() {
                return QueryType.CREATE;
            }

            @Override
            public ResponseFormat getResponseFormat() {
                return ResponseFormat.JSON;
            }

            @Override
            public HttpUrl buildUri(String hostName) {
                return HttpUrl.get(hostName);
            }
        };

        assertThrows(IllegalArgumentException.class, () -> plainContext().getResponse(query, ItemResponse::new));
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void testBuildRequest() {
        AuthenticatedWebApiDataContext context = plainContext();
        HttpUrl uri = HttpUrl.get(context.getHostName());

        HttpRequest read = context.buildRequest(uri, QueryType.READ);
        assertNull(read.getContentType());
        assertEquals("close", read.getHeader("Connection"));

        HttpRequest update = context.buildRequest(uri, QueryType.UPDATE, "Title=Welcome");
        assertEquals(AuthenticatedWebApiDataContext.FORM_URLENCODED, update.getContentType());
        assertEquals("Title=Welcome", update.getContent().getLeft());
        assertEquals(PASSWORD, update.getHeader(AuthenticationHeaders.PASSWORD));
    }

    @Test
    void testTransportFailureCaptured() throws IOException {
        AuthenticatedWebApiDataContext context = plainContext();
        mockWebServer.shutdown();

        ItemQuery query = new ItemQuery.Builder().withPath("/sitecore/content/Home").build();
        ItemResponse response = context.getResponse(query, ItemResponse::new);

        assertEquals(500, response.getStatusCode());
        assertTrue(response.getInfo().hasError());
    }
}
