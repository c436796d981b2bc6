package org.neurosync.http;

import java.util.Objects;

/**
 * A single request to a backend.
 *
 * @param method  the HTTP method
 * @param url     absolute target URL
 * @param payload JSON body for {@link HttpMethod#POST}, otherwise {@code null}
 */
public record HttpCall(HttpMethod method, String url, String payload) {

    public HttpCall {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
    }

    public static HttpCall get(String url) {
        return new HttpCall(HttpMethod.GET, url, null);
    }

    public static HttpCall post(String url, String payload) {
        return new HttpCall(HttpMethod.POST, url, payload);
    }

    public static HttpCall delete(String url) {
        return new HttpCall(HttpMethod.DELETE, url, null);
    }
}
