package org.neurosync.http;

import java.net.http.HttpRequest;
import java.util.concurrent.CompletableFuture;

/**
 * Bare network primitive below the credential, refresh and retry policies of
 * {@link CredentialedHttpClient}.
 * <p>
 * Implementations must not interpret status codes: every response that arrives, whatever
 * its status, completes the future normally. Only transport failures complete it
 * exceptionally.
 */
public interface IHttpTransport {

    CompletableFuture<HttpResult> send(HttpRequest request);
}
