package com.sharedsource.webapi.query;

import okhttp3.FormBody;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered item field name to value map.
 * <p>Serialized as an {@code application/x-www-form-urlencoded} body.
 */
public class FieldMap {

    private final Map<String, String> fields = new LinkedHashMap<>();

    /**
     * Puts a field value.
     *
     * @param name  Field name or field id.
     * @param value Field value.
     * @return Self.
     */
    public FieldMap put(String name, String value) {
        fields.put(Objects.requireNonNull(name, "name must not be null"), value != null ? value : "");
        return this;
    }

    /**
     * Puts all field values.
     *
     * @param values Map of field name to value.
     * @return Self.
     */
    public FieldMap putAll(Map<String, String> values) {
        values.forEach(this::put);
        return this;
    }

    /**
     * Gets field values.
     *
     * @return Unmodifiable map.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /**
     * Serializes the fields as UTF-8 form url encoded text.
     *
     * @return String, empty if there are no fields.
     */
    public String toQueryString() {
        FormBody.Builder builder = new FormBody.Builder(StandardCharsets.UTF_8);
        fields.forEach(builder::add);
        FormBody body = builder.build();

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.size(); i++) {
            if (i > 0) {
                sb.append('&');
            }
            sb.append(body.encodedName(i)).append('=').append(body.encodedValue(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return fields.keySet().toString();
    }
}
