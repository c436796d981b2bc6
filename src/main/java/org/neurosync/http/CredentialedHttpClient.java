package org.neurosync.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.neurosync.api.AnnotationSyncException;
import org.neurosync.api.AuthException;
import org.neurosync.api.HttpStatusException;
import org.neurosync.api.TransientServerException;
import org.neurosync.credentials.ICredentialsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client layering credential injection, refresh-on-auth-failure and gateway-timeout
 * retry around an {@link IHttpTransport}.
 * <p>
 * Per request:
 * <ol>
 *   <li>The token from the credentials provider is sent as {@code Authorization: Bearer}.
 *       Without a token the request relies on the transport's ambient cookies.</li>
 *   <li>On 401 or 403 the token is invalidated and the request repeated once, if the call is
 *       marked refreshable. Otherwise, or if the repeat fails again, {@link AuthException}.</li>
 *   <li>On 504 the request is repeated after {@link HttpSettings#gatewayRetryDelay()}, at most
 *       {@link HttpSettings#maxGatewayRetries()} times, then {@link TransientServerException}.</li>
 *   <li>Any other non-2xx status fails with {@link HttpStatusException}.</li>
 * </ol>
 * Cancelling the token aborts the in-flight exchange and completes the returned future with
 * {@link CancellationException}.
 * <p>
 * <strong>Thread Safety:</strong> This class is stateless apart from its collaborators and is
 * thread-safe.
 */
public class CredentialedHttpClient {

    private static final Logger log = LoggerFactory.getLogger(CredentialedHttpClient.class);

    private final IHttpTransport transport;
    private final HttpSettings settings;
    private final ObjectMapper mapper;

    public CredentialedHttpClient(IHttpTransport transport, HttpSettings settings, ObjectMapper mapper) {
        this.transport = transport;
        this.settings = settings;
        this.mapper = mapper;
    }

    public CompletableFuture<HttpResult> request(ICredentialsProvider credentials, boolean tokenRefreshable,
                                                 HttpCall call, CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Request to " + call.url() + " was cancelled"));
        }
        Exchange exchange = new Exchange(credentials, tokenRefreshable, call, cancellationToken);
        CancellationToken.Registration registration = cancellationToken.onCancel(exchange::abort);
        exchange.result.whenComplete((value, error) -> registration.remove());
        attempt(exchange, false, 0);
        return exchange.result;
    }

    /**
     * Like {@link #request} but parses the body as JSON. An empty body yields a
     * {@link MissingNode}.
     */
    public CompletableFuture<JsonNode> requestJson(ICredentialsProvider credentials, boolean tokenRefreshable,
                                                   HttpCall call, CancellationToken cancellationToken) {
        return request(credentials, tokenRefreshable, call, cancellationToken)
            .thenApply(result -> parseJson(call, result));
    }

    public CompletableFuture<String> requestText(ICredentialsProvider credentials, boolean tokenRefreshable,
                                                 HttpCall call, CancellationToken cancellationToken) {
        return request(credentials, tokenRefreshable, call, cancellationToken).thenApply(HttpResult::body);
    }

    private void attempt(Exchange exchange, boolean refreshed, int gatewayRetries) {
        if (exchange.result.isDone()) {
            return;
        }
        HttpCall call = exchange.call;
        exchange.credentials.get(exchange.cancellationToken)
            .thenCompose(token -> {
                log.debug("{} {}", call.method(), call.url());
                CompletableFuture<HttpResult> inFlight = transport.send(buildRequest(call, token));
                exchange.inFlight = inFlight;
                return inFlight;
            })
            .whenComplete((response, error) -> {
                if (exchange.result.isDone()) {
                    return;
                }
                if (error != null) {
                    fail(exchange, error);
                    return;
                }
                handleResponse(exchange, response, refreshed, gatewayRetries);
            });
    }

    private void handleResponse(Exchange exchange, HttpResult response, boolean refreshed, int gatewayRetries) {
        HttpCall call = exchange.call;
        int status = response.statusCode();
        if (response.isSuccess()) {
            exchange.result.complete(response);
        } else if (status == 401 || status == 403) {
            if (exchange.tokenRefreshable && !refreshed) {
                log.info("{} {} returned {}, refreshing credentials and retrying", call.method(), call.url(), status);
                exchange.credentials.invalidate();
                attempt(exchange, true, gatewayRetries);
            } else {
                exchange.result.completeExceptionally(new AuthException(
                    call.method() + " " + call.url() + " was rejected with HTTP " + status, status));
            }
        } else if (status == 504) {
            if (gatewayRetries < settings.maxGatewayRetries()) {
                log.warn("Gateway timeout for {} {}, retrying ({}/{})",
                    call.method(), call.url(), gatewayRetries + 1, settings.maxGatewayRetries());
                Executor delayed = CompletableFuture.delayedExecutor(
                    settings.gatewayRetryDelay().toMillis(), TimeUnit.MILLISECONDS);
                CompletableFuture.runAsync(() -> attempt(exchange, refreshed, gatewayRetries + 1), delayed);
            } else {
                exchange.result.completeExceptionally(new TransientServerException(
                    "Gateway timeout for " + call.method() + " " + call.url() + " persisted after "
                        + (gatewayRetries + 1) + " attempts", gatewayRetries + 1));
            }
        } else {
            exchange.result.completeExceptionally(new HttpStatusException(call.url(), status, response.body()));
        }
    }

    private void fail(Exchange exchange, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            exchange.result.cancel(true);
        } else if (cause instanceof AnnotationSyncException) {
            exchange.result.completeExceptionally(cause);
        } else {
            exchange.result.completeExceptionally(new AnnotationSyncException(
                "Request " + exchange.call.method() + " " + exchange.call.url() + " failed: " + cause.getMessage(),
                cause));
        }
    }

    private HttpRequest buildRequest(HttpCall call, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(call.url()));
        switch (call.method()) {
            case GET -> builder.GET();
            case DELETE -> builder.DELETE();
            case POST -> builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(call.payload() == null ? "" : call.payload()));
        }
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "Bearer " + token);
        } else if (call.url().startsWith("https:")) {
            log.debug("No token for {}, relying on session cookies", call.url());
        }
        return builder.build();
    }

    private JsonNode parseJson(HttpCall call, HttpResult result) {
        if (result.body().isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new AnnotationSyncException("Invalid JSON response from " + call.url() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * State of one logical request across its attempts.
     */
    private static final class Exchange {
        private final ICredentialsProvider credentials;
        private final boolean tokenRefreshable;
        private final HttpCall call;
        private final CancellationToken cancellationToken;
        private final CompletableFuture<HttpResult> result = new CompletableFuture<>();
        private volatile CompletableFuture<HttpResult> inFlight;

        private Exchange(ICredentialsProvider credentials, boolean tokenRefreshable, HttpCall call,
                         CancellationToken cancellationToken) {
            this.credentials = credentials;
            this.tokenRefreshable = tokenRefreshable;
            this.call = call;
            this.cancellationToken = cancellationToken;
        }

        private void abort() {
            result.cancel(true);
            CompletableFuture<HttpResult> pending = inFlight;
            if (pending != null) {
                pending.cancel(true);
            }
        }
    }
}
