package org.neurosync.credentials;

import java.util.concurrent.CompletableFuture;

/**
 * Platform-specific login flow for the hub realm.
 */
@FunctionalInterface
public interface IHubTokenSource {

    CompletableFuture<String> fetchToken(String realm);

    /**
     * @return a source that never yields a token
     */
    static IHubTokenSource none() {
        return realm -> CompletableFuture.completedFuture("");
    }
}
