package com.sharedsource.webapi.query;

/**
 * Response body formats.
 */
public enum ResponseFormat {
    JSON,
    XML
}
