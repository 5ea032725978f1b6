package com.sharedsource.webapi.response;

import com.google.gson.annotations.SerializedName;

/**
 * Item field value.
 */
public class ItemField {

    @SerializedName(value = "Name", alternate = {"name"})
    private String name;

    @SerializedName(value = "Type", alternate = {"type"})
    private String type;

    @SerializedName(value = "Value", alternate = {"value", "#text"})
    private String value;

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }
}
