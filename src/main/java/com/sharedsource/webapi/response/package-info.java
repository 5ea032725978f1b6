/**
 * Typed responses of the item web API.
 *
 * <p>All responses implement {@link com.sharedsource.webapi.response.BaseResponse}.
 * <br>A data context always hands back a response object, even when the call failed.
 * <br>Callers inspect {@link com.sharedsource.webapi.response.BaseResponse#getStatusCode()} and
 * {@link com.sharedsource.webapi.response.ResponseInfo} to tell the difference.
 *
 * <p>Field names accept both the camel case and the Pascal case spelling the server
 * uses across JSON and XML payloads.
 */
package com.sharedsource.webapi.response;
