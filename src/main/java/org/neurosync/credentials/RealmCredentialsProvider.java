package org.neurosync.credentials;

import org.neurosync.api.AuthException;
import org.neurosync.http.CancellationToken;
import org.neurosync.http.HttpResult;
import org.neurosync.http.IHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Credentials provider for one {@link AuthRealm}.
 * <p>
 * The token is acquired once and shared by all callers until {@link #invalidate()} is called
 * or the acquisition fails. Cancelling one caller's token does not abort the shared
 * acquisition.
 * <p>
 * <strong>Thread Safety:</strong> All methods are thread-safe.
 */
public class RealmCredentialsProvider implements ICredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(RealmCredentialsProvider.class);

    private final AuthRealm realm;
    private final IHttpTransport transport;
    private final IHubTokenSource hubTokenSource;

    private CompletableFuture<String> current;

    public RealmCredentialsProvider(AuthRealm realm, IHttpTransport transport, IHubTokenSource hubTokenSource) {
        this.realm = realm;
        this.transport = transport;
        this.hubTokenSource = hubTokenSource;
    }

    public AuthRealm getRealm() {
        return realm;
    }

    @Override
    public CompletableFuture<String> get(CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            return CompletableFuture.failedFuture(
                new CancellationException("Credential request was cancelled"));
        }
        CompletableFuture<String> shared;
        synchronized (this) {
            if (current == null || current.isCompletedExceptionally()) {
                current = acquire();
            }
            shared = current;
        }
        return cancellationToken.bind(shared.thenApply(token -> token));
    }

    @Override
    public synchronized void invalidate() {
        log.debug("Invalidating credentials for realm {}", realm);
        current = null;
    }

    private CompletableFuture<String> acquire() {
        return switch (realm.getKind()) {
            case NONE -> CompletableFuture.completedFuture("");
            case LITERAL_TOKEN -> CompletableFuture.completedFuture(realm.getLiteralToken());
            case HUB -> hubTokenSource.fetchToken(realm.getRealm());
            case URL -> fetchFromUrl();
            case UNSUPPORTED -> CompletableFuture.failedFuture(
                new AuthException("Unsupported authentication realm: " + realm, 0));
        };
    }

    private CompletableFuture<String> fetchFromUrl() {
        log.debug("Fetching token from {}", realm.getRealm());
        return requestToken()
            .exceptionallyCompose(first -> {
                log.info("Token request to {} failed ({}), trying once more", realm.getRealm(), first.getMessage());
                return requestToken();
            });
    }

    private CompletableFuture<String> requestToken() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(realm.getRealm()))
            .header("Accept", "text/plain")
            .GET()
            .build();
        return transport.send(request).thenApply(this::tokenFrom);
    }

    private String tokenFrom(HttpResult result) {
        if (!result.isSuccess()) {
            throw new AuthException(
                "Failed to obtain a token from " + realm.getRealm() + ": HTTP " + result.statusCode(),
                result.statusCode());
        }
        return result.body().trim();
    }
}
