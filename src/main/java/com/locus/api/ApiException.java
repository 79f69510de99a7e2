package com.locus.api;

/**
 * A failed call to the workspace API. {@code statusCode} is 0 when the request
 * never produced an HTTP response (connection refused, timeout).
 */
public class ApiException extends RuntimeException {

    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /**
     * Client errors that will not succeed on retry. 408 and 429 are excluded
     * because the server asks the caller to come back later.
     */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500 && statusCode != 408 && statusCode != 429;
    }
}
