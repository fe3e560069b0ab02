package com.slipway.deploy;

/**
 * A Cloud Foundry API call failed. {@code status} is the HTTP status, or 0 when no
 * response was received.
 */
public class CfApiException extends RuntimeException {

    private final int status;

    public CfApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public CfApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }

    public boolean isAuthOrNotFound() {
        return status == 401 || status == 403 || status == 404;
    }
}
