package com.sharedsource.webapi.response;

import com.sharedsource.webapi.response.ResponseInfo.Outcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ItemResponseTest {

    @Test
    void testEmptyResponse() {
        ItemResponse response = new ItemResponse();

        assertNull(response.getResult());
        assertNull(response.getError());
        assertTrue(response.getItems().isEmpty());
        assertFalse(response.isSuccess());
    }

    @Test
    void testSuccess() {
        ItemResponse response = new ItemResponse();
        response.setInfo(new ResponseInfo("http://cms.example.com/-/item/v1", Duration.ofMillis(12)));
        response.setStatusCode(201);

        assertTrue(response.isSuccess());
        assertFalse(response.getInfo().hasError());

        response.setStatusCode(404);
        assertFalse(response.isSuccess());
    }

    @Test
    void testFailedOutcome() {
        ItemResponse response = new ItemResponse();
        response.setStatusCode(200);
        response.setInfo(new ResponseInfo()
                .setOutcome(Outcome.TRANSPORT_ERROR)
                .setErrorMessage("Connection refused"));

        assertFalse(response.isSuccess());
        assertTrue(response.getInfo().hasError());
        assertEquals(Duration.ZERO, response.getInfo().getResponseTime());
        assertTrue(response.getInfo().toString().contains("Connection refused"));
    }

    @Test
    void testPublicKeyValidation() {
        assertTrue(new PublicKeyResponse("wJ3kTz8Q", "AQAB").validate());
        assertFalse(new PublicKeyResponse("wJ3kTz8Q", " ").validate());
        assertFalse(new PublicKeyResponse().validate());
    }
}
