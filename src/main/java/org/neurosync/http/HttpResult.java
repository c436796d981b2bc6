package org.neurosync.http;

/**
 * Status and body of a completed HTTP exchange.
 *
 * @param statusCode HTTP status code
 * @param body       response body decoded as UTF-8, never {@code null}
 */
public record HttpResult(int statusCode, String body) {

    public HttpResult {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
