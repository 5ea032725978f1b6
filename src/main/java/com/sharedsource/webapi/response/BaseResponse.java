package com.sharedsource.webapi.response;

/**
 * Response capability populated by a data context.
 * <p>Every response carries a status and an info block, whether the call succeeded or not.
 */
public interface BaseResponse {

    /**
     * Gets status code.
     *
     * @return Integer.
     */
    int getStatusCode();

    /**
     * Sets status code.
     *
     * @param statusCode Status code.
     */
    void setStatusCode(int statusCode);

    /**
     * Gets status description.
     *
     * @return String.
     */
    String getStatusDescription();

    /**
     * Sets status description.
     *
     * @param statusDescription Status description.
     */
    void setStatusDescription(String statusDescription);

    /**
     * Gets response info.
     *
     * @return ResponseInfo instance or null if the response was never executed.
     */
    ResponseInfo getInfo();

    /**
     * Sets response info.
     *
     * @param info ResponseInfo instance.
     */
    void setInfo(ResponseInfo info);

    /**
     * Checks if the call succeeded.
     *
     * @return True if the exchange completed and the status code is 2xx.
     */
    default boolean isSuccess() {
        return getInfo() != null
                && getInfo().getOutcome() == ResponseInfo.Outcome.SUCCESS
                && getStatusCode() >= 200 && getStatusCode() < 300;
    }
}
