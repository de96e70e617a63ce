package com.krickert.testcontainers.speaches.client;

/**
 * Status code and body text of one Speaches HTTP call.
 */
public record ApiResponse(int statusCode, String body) {

    public ApiResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
