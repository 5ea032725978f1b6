package com.sharedsource.webapi.response;

import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Content item as serialized by the item web API.
 * <p>Fields are keyed by field id.
 */
public class Item {

    @SerializedName(value = "ID", alternate = {"id", "Id"})
    private String id;

    @SerializedName(value = "Name", alternate = {"name"})
    private String name;

    @SerializedName(value = "DisplayName", alternate = {"displayName"})
    private String displayName;

    @SerializedName(value = "Path", alternate = {"path"})
    private String path;

    @SerializedName(value = "Template", alternate = {"template"})
    private String template;

    @SerializedName(value = "Database", alternate = {"database"})
    private String database;

    @SerializedName(value = "Language", alternate = {"language"})
    private String language;

    @SerializedName(value = "Version", alternate = {"version"})
    private int version;

    @SerializedName(value = "HasChildren", alternate = {"hasChildren"})
    private boolean hasChildren;

    @SerializedName(value = "Fields", alternate = {"fields"})
    private Map<String, ItemField> fields = new LinkedHashMap<>();

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getPath() {
        return path;
    }

    public String getTemplate() {
        return template;
    }

    public String getDatabase() {
        return database;
    }

    public String getLanguage() {
        return language;
    }

    public int getVersion() {
        return version;
    }

    public boolean hasChildren() {
        return hasChildren;
    }

    public Map<String, ItemField> getFields() {
        return fields != null ? fields : new LinkedHashMap<>();
    }

    /**
     * Finds a field by its name.
     *
     * @param fieldName Field name, case-insensitive.
     * @return Optional of ItemField.
     */
    public Optional<ItemField> getField(String fieldName) {
        return getFields().values().stream()
                .filter(field -> field.getName() != null && field.getName().equalsIgnoreCase(fieldName))
                .findFirst();
    }

    @Override
    public String toString() {
        return "Item{id='" + id + "', path='" + path + "'}";
    }
}
