/**
 * Item web API queries.
 *
 * <p>A query knows its type, the response format it expects and how to build its URI for a host.
 * <br>{@link com.sharedsource.webapi.query.ItemQuery} covers item reads and writes.
 * <br>{@link com.sharedsource.webapi.query.ActionQuery} covers server actions like {@code getpublickey}.
 *
 * <p>Create and update queries implement {@link com.sharedsource.webapi.query.UpdatableQuery}
 * <br>and are only accepted by authenticated data contexts.
 */
package com.sharedsource.webapi.query;
