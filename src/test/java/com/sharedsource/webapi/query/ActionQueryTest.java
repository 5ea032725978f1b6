package com.sharedsource.webapi.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionQueryTest {

    @Test
    void testPublicKeyUri() {
        ActionQuery query = new ActionQuery(ActionQuery.GET_PUBLIC_KEY);

        assertEquals("http://cms.example.com/-/item/v1/-/actions/getpublickey",
                query.buildUri("http://cms.example.com").toString());
        assertEquals(QueryType.READ, query.getQueryType());
        assertEquals(ResponseFormat.JSON, query.getResponseFormat());
    }

    @Test
    void testResponseFormat() {
        assertEquals(ResponseFormat.XML, new ActionQuery("custom", ResponseFormat.XML).getResponseFormat());
    }

    @Test
    void testBlankAction() {
        assertThrows(IllegalArgumentException.class, () -> new ActionQuery(" "));
        assertThrows(IllegalArgumentException.class, () -> new ActionQuery(null));
    }
}
