package org.neurosync.http;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * {@link IHttpTransport} on top of {@link HttpClient}.
 * <p>
 * The client keeps a cookie store, which provides the ambient session credentials used for
 * secure requests that carry no bearer token.
 */
public class JdkHttpTransport implements IHttpTransport {

    private final HttpClient client;

    public JdkHttpTransport(HttpSettings settings) {
        this.client = HttpClient.newBuilder()
            .connectTimeout(settings.connectTimeout())
            .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ORIGINAL_SERVER))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public JdkHttpTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<HttpResult> send(HttpRequest request) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> new HttpResult(response.statusCode(), response.body()));
    }
}
