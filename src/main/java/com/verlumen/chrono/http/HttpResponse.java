package com.verlumen.chrono.http;

/** Status code and body text of a completed request. */
public record HttpResponse(int statusCode, String body) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
