package com.ecoscore.impact.client;

/**
 * HTTP or transport failure while calling the assessment API.
 */
public class EcoScoreClientException extends RuntimeException {

    // -1 when no HTTP response was received
    private final int statusCode;

    public EcoScoreClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
