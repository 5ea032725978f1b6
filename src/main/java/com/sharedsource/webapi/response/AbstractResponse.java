package com.sharedsource.webapi.response;

import com.google.gson.annotations.SerializedName;

/**
 * Common response state.
 *
 * <p>The status code is read from the response body when the server sends one.
 * <br>The status description and info block are never read from the body.
 */
public abstract class AbstractResponse implements BaseResponse {

    @SerializedName(value = "statusCode", alternate = {"StatusCode"})
    private int statusCode;

    private transient String statusDescription;
    private transient ResponseInfo info;

    @Override
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public void setStatusCode(int statusCode) {
        this.statusCode = statusCode;
    }

    @Override
    public String getStatusDescription() {
        return statusDescription;
    }

    @Override
    public void setStatusDescription(String statusDescription) {
        this.statusDescription = statusDescription;
    }

    @Override
    public ResponseInfo getInfo() {
        return info;
    }

    @Override
    public void setInfo(ResponseInfo info) {
        this.info = info;
    }
}
