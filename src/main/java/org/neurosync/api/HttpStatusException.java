package org.neurosync.api;

/**
 * Terminal HTTP failure for any status that is neither handled by the refresh path
 * (401/403) nor by the gateway-timeout path (504).
 */
public class HttpStatusException extends AnnotationSyncException {

    private final int statusCode;
    private final String url;
    private final String responseBody;

    public HttpStatusException(String url, int statusCode, String responseBody) {
        super(String.format("Request to %s failed with HTTP status %d", url, statusCode));
        this.url = url;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
