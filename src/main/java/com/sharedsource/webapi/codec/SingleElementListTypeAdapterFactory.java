package com.sharedsource.webapi.codec;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Lets collection fields bind from trees that XML cannot express as arrays.
 *
 * <p>A list with a single entry has no repeated element in XML, and list entries are
 * usually nested in a wrapper like {@code <Items><Item/></Items>}. Accepted shapes:
 * <ul>
 *   <li>An array, bound as is.</li>
 *   <li>An object with a single array member, bound as that array.</li>
 *   <li>An object with a single object member, bound as a one-element list of that member.</li>
 *   <li>An empty object, bound as an empty list.</li>
 *   <li>Anything else, bound as a one-element list.</li>
 * </ul>
 */
public class SingleElementListTypeAdapterFactory implements TypeAdapterFactory {

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!Collection.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
        TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                delegate.write(out, value);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                return delegate.fromJsonTree(toArray(elementAdapter.read(in)));
            }
        };
    }

    /**
     * Coerces a tree into an array.
     *
     * @param tree JsonElement.
     * @return JsonElement, an array unless the tree is null.
     */
    static JsonElement toArray(JsonElement tree) {
        if (tree == null || tree.isJsonNull() || tree.isJsonArray()) {
            return tree;
        }

        JsonArray array = new JsonArray();
        if (tree.isJsonObject()) {
            JsonObject object = tree.getAsJsonObject();
            if (object.size() == 0) {
                return array;
            }

            if (object.size() == 1) {
                Map.Entry<String, JsonElement> only = object.entrySet().iterator().next();
                if (only.getValue().isJsonArray()) {
                    return only.getValue();
                }
                if (only.getValue().isJsonObject()) {
                    array.add(only.getValue());
                    return array;
                }
            }
        }

        array.add(tree);
        return array;
    }
}
