package com.sharedsource.webapi.query;

import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ItemQueryTest {

    private static final String HOST = "http://cms.example.com";

    @Test
    void testReadByPath() {
        ItemQuery query = new ItemQuery.Builder()
                .withPath("/sitecore/content/Home/")
                .withDatabase("web")
                .withLanguage("en")
                .build();

        HttpUrl uri = query.buildUri(HOST);

        assertEquals(QueryType.READ, query.getQueryType());
        assertEquals(ResponseFormat.JSON, query.getResponseFormat());
        assertEquals("/-/item/v1/sitecore/content/Home", uri.encodedPath());
        assertEquals("web", uri.queryParameter("sc_database"));
        assertEquals("en", uri.queryParameter("language"));
        assertNull(uri.queryParameter("sc_itemid"));
    }

    @Test
    void testAllParameters() {
        ItemQuery query = new ItemQuery.Builder()
                .withItemId("{110D559F-DEA5-42EA-9C1C-8A5DF7E70EF9}")
                .withVersion(2)
                .withScope(ItemQuery.Scope.SELF, ItemQuery.Scope.CHILDREN)
                .withFields("Title", "Text")
                .withPayload("content")
                .withPage(1, 10)
                .build();

        HttpUrl uri = query.buildUri("https://cms.example.com:8443");

        assertEquals("https", uri.scheme());
        assertEquals(8443, uri.port());
        assertEquals("/-/item/v1", uri.encodedPath());
        assertEquals("{110D559F-DEA5-42EA-9C1C-8A5DF7E70EF9}", uri.queryParameter("sc_itemid"));
        assertEquals("2", uri.queryParameter("sc_itemversion"));
        assertEquals("s|c", uri.queryParameter("scope"));
        assertEquals("Title|Text", uri.queryParameter("fields"));
        assertEquals("content", uri.queryParameter("payload"));
        assertEquals("1", uri.queryParameter("page"));
        assertEquals("10", uri.queryParameter("pageSize"));
    }

    @Test
    void testItemQueryExpressionEncoded() {
        ItemQuery query = new ItemQuery.Builder()
                .withQuery("/sitecore/content/Home/*[@@templatename='Sample Item']")
                .build();

        HttpUrl uri = query.buildUri(HOST);

        assertEquals("/sitecore/content/Home/*[@@templatename='Sample Item']", uri.queryParameter("query"));
        assertFalse(uri.encodedQuery().contains(" "));
    }

    @Test
    void testCreateAddsNameAndTemplate() {
        ItemQuery query = new ItemQuery.Builder()
                .withType(QueryType.CREATE)
                .withPath("/sitecore/content/Home")
                .withName("News")
                .withTemplate("Sample/Sample Item")
                .withField("Title", "News")
                .build();

        HttpUrl uri = query.buildUri(HOST);

        assertEquals("News", uri.queryParameter("name"));
        assertEquals("Sample/Sample Item", uri.queryParameter("template"));
        assertEquals("Title=News", query.getFieldsToUpdate().toQueryString());
    }

    @Test
    void testNameIgnoredOutsideCreate() {
        ItemQuery query = new ItemQuery.Builder()
                .withType(QueryType.UPDATE)
                .withPath("/sitecore/content/Home")
                .withName("News")
                .build();

        assertNull(query.buildUri(HOST).queryParameter("name"));
    }

    @Test
    void testTargetRequired() {
        ItemQuery.Builder builder = new ItemQuery.Builder().withDatabase("web");

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testCreateRequiresNameAndTemplate() {
        ItemQuery.Builder builder = new ItemQuery.Builder()
                .withType(QueryType.CREATE)
                .withPath("/sitecore/content/Home")
                .withName("News");

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testQueryTypes() {
        assertTrue(QueryType.CREATE.isMutating());
        assertTrue(QueryType.UPDATE.isMutating());
        assertFalse(QueryType.READ.isMutating());
        assertFalse(QueryType.DELETE.isMutating());
    }
}
