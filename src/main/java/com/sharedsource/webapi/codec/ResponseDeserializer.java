package com.sharedsource.webapi.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.sharedsource.webapi.query.ResponseFormat;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.Objects;

/**
 * Binds response bodies to response types.
 *
 * <p>JSON is read by Gson directly.
 * <br>XML is first parsed into a Gson tree by {@link XmlTreeParser} and then bound by the same Gson instance.
 * <br>Unknown members are ignored in both formats.
 *
 * <p>Blank bodies are not parsed, the supplied default is returned instead.
 */
public class ResponseDeserializer {

    private final Gson gson;

    /**
     * Constructs a new ResponseDeserializer instance.
     */
    public ResponseDeserializer() {
        this.gson = new GsonBuilder()
                .registerTypeAdapterFactory(new SingleElementListTypeAdapterFactory())
                .create();
    }

    /**
     * Deserializes a body in the given format.
     *
     * @param body         Response body.
     * @param format       Response format.
     * @param defaultValue Value returned for blank bodies, also gives the target type.
     * @param <T>          Response type.
     * @return Deserialized instance or default value.
     * @throws DeserializationException If the body cannot be bound.
     */
    public <T> T deserialize(String body, ResponseFormat format, T defaultValue) throws DeserializationException {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(defaultValue, "defaultValue must not be null");

        switch (format) {
            case XML:
                return fromXml(body, defaultValue);
            case JSON:
            default:
                return fromJson(body, defaultValue);
        }
    }

    /**
     * Deserializes a JSON body.
     *
     * @param body         Response body.
     * @param defaultValue Value returned for blank bodies, also gives the target type.
     * @param <T>          Response type.
     * @return Deserialized instance or default value.
     * @throws DeserializationException If the body cannot be bound.
     */
    public <T> T fromJson(String body, T defaultValue) throws DeserializationException {
        if (StringUtils.isBlank(body)) {
            return defaultValue;
        }

        try {
            T result = gson.fromJson(body, typeOf(defaultValue));
            return result != null ? result : defaultValue;
        } catch (JsonParseException | IllegalStateException e) {
            throw new DeserializationException("Unable to deserialize JSON response: " + e.getMessage(), e);
        }
    }

    /**
     * Deserializes an XML body.
     *
     * @param body         Response body.
     * @param defaultValue Value returned for blank bodies, also gives the target type.
     * @param <T>          Response type.
     * @return Deserialized instance or default value.
     * @throws DeserializationException If the body cannot be bound.
     */
    public <T> T fromXml(String body, T defaultValue) throws DeserializationException {
        if (StringUtils.isBlank(body)) {
            return defaultValue;
        }

        try {
            JsonElement tree = XmlTreeParser.parse(body);
            T result = gson.fromJson(tree, typeOf(defaultValue));
            return result != null ? result : defaultValue;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new DeserializationException("Unable to deserialize XML response: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<T> typeOf(T value) {
        return (Class<T>) value.getClass();
    }
}
