package com.sharedsource.webapi.response;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * Item web API response for read, create, update and delete queries.
 *
 * <p>Successful calls fill {@link #getResult()}, failed calls fill {@link #getError()}.
 * <br>Example body:
 * <pre>
 * {"statusCode":200,"result":{"totalCount":1,"resultCount":1,"items":[{"ID":"{...}","Name":"Home"}]}}
 * </pre>
 */
public class ItemResponse extends AbstractResponse {

    @SerializedName(value = "result", alternate = {"Result"})
    private Result result;

    @SerializedName(value = "error", alternate = {"Error"})
    private Error error;

    /**
     * Gets result.
     *
     * @return Result instance or null for failed or empty responses.
     */
    public Result getResult() {
        return result;
    }

    /**
     * Gets error.
     *
     * @return Error instance or null.
     */
    public Error getError() {
        return error;
    }

    /**
     * Gets result items.
     *
     * @return List of Item, empty if none.
     */
    public List<Item> getItems() {
        return result != null ? result.getItems() : new ArrayList<>();
    }

    /**
     * Query result.
     */
    public static class Result {

        @SerializedName(value = "totalCount", alternate = {"TotalCount"})
        private int totalCount;

        @SerializedName(value = "resultCount", alternate = {"ResultCount"})
        private int resultCount;

        @SerializedName(value = "count", alternate = {"Count"})
        private int count;

        @SerializedName(value = "items", alternate = {"Items"})
        private List<Item> items = new ArrayList<>();

        public int getTotalCount() {
            return totalCount;
        }

        public int getResultCount() {
            return resultCount;
        }

        /**
         * Gets affected item count as reported by delete queries.
         *
         * @return Integer.
         */
        public int getCount() {
            return count;
        }

        public List<Item> getItems() {
            return items != null ? items : new ArrayList<>();
        }
    }

    /**
     * Server side error.
     */
    public static class Error {

        @SerializedName(value = "code", alternate = {"Code"})
        private int code;

        @SerializedName(value = "message", alternate = {"Message"})
        private String message;

        public int getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }
}
