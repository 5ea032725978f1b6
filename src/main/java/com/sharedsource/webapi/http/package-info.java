/**
 * HTTP request plumbing for the item web API.
 *
 * <p>The {@link com.sharedsource.webapi.http.HttpRequest} is a lightweight programmatic container
 * <br>used to assemble requests prior to execution by a data context.
 * <br>It stores the URL, HTTP method, headers and textual content.
 *
 * <p>The {@link com.sharedsource.webapi.http.AuthenticationHeaders} hold the custom header names
 * <br>the server reads credentials from.
 *
 * @see com.sharedsource.webapi.http.HttpRequest
 * @see com.sharedsource.webapi.data.DataContext
 */
package com.sharedsource.webapi.http;
