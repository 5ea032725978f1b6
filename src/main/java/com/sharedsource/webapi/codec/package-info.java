/**
 * Response body deserialization.
 *
 * <p>The {@link com.sharedsource.webapi.codec.ResponseDeserializer} binds JSON and XML bodies
 * <br>to response types with Gson. XML goes through {@link com.sharedsource.webapi.codec.XmlTreeParser} first.
 */
package com.sharedsource.webapi.codec;
