package org.neurosync.api;

/**
 * Thrown when the backend rejects a request with 401 or 403 and the credentials could not be
 * refreshed, either because the realm is not refreshable or because the single refresh
 * attempt was rejected as well.
 */
public class AuthException extends AnnotationSyncException {

    private final int statusCode;

    public AuthException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
