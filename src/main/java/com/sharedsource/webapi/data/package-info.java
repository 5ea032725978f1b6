/**
 * Data contexts executing item web API queries against one host.
 *
 * <p>{@link com.sharedsource.webapi.data.WebApiDataContext} runs anonymous read and delete queries.
 * <br>{@link com.sharedsource.webapi.data.AuthenticatedWebApiDataContext} adds credential headers,
 * <br>optionally RSA encrypted with the server public key, and supports create and update queries.
 *
 * <p>Both compose the same request executor, so failures are mapped in one place:
 * <ul>
 *   <li>Transport errors give status 500 with a TRANSPORT_ERROR outcome.</li>
 *   <li>Error statuses keep the server status code and description.</li>
 *   <li>Unreadable success bodies give status 500 with an UNEXPECTED_ERROR outcome.</li>
 * </ul>
 *
 * <p>Contexts may also be created from a JSON5 file via {@link com.sharedsource.webapi.data.DataContextFactory}.
 */
package com.sharedsource.webapi.data;
