package org.neurosync.credentials;

import org.neurosync.http.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies the bearer token for one authentication realm.
 * <p>
 * Implementations cache the token and hand out the same value until {@link #invalidate()} is
 * called. An empty string means "no token"; the request then relies on ambient credentials.
 */
public interface ICredentialsProvider {

    CompletableFuture<String> get(CancellationToken cancellationToken);

    /**
     * Discards the cached token so that the next {@link #get(CancellationToken)} acquires a
     * fresh one.
     */
    void invalidate();
}
