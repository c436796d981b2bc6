package org.neurosync.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.neurosync.cache.AnnotationCacheRegistry;
import org.neurosync.credentials.CredentialsManager;
import org.neurosync.credentials.ICredentialsProvider;
import org.neurosync.credentials.IHubTokenSource;
import org.neurosync.credentials.TokenUsers;
import org.neurosync.encoding.AnnotationEncoderFactory;
import org.neurosync.encoding.EncoderSet;
import org.neurosync.http.CancellationToken;
import org.neurosync.http.CredentialedHttpClient;
import org.neurosync.http.HttpSettings;
import org.neurosync.http.IHttpTransport;
import org.neurosync.http.JdkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Process-level wiring: one transport, one HTTP client, one credentials manager and one cache
 * registry shared by every collection opened through this context.
 */
public class NeurosyncContext {

    private static final Logger log = LoggerFactory.getLogger(NeurosyncContext.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final CredentialedHttpClient httpClient;
    private final CredentialsManager credentialsManager;
    private final AnnotationCacheRegistry caches = new AnnotationCacheRegistry();
    private final String defaultKind;
    private final List<AnnotationPropertySpec> propertySpecs;
    private final Clock clock;

    public NeurosyncContext(Config config) {
        this(config, new JdkHttpTransport(HttpSettings.fromConfig(config.getConfig("neurosync.http"))),
            IHubTokenSource.none(), Clock.systemUTC());
    }

    public NeurosyncContext(Config config, IHttpTransport transport, IHubTokenSource hubTokenSource, Clock clock) {
        HttpSettings settings = HttpSettings.fromConfig(config.getConfig("neurosync.http"));
        this.httpClient = new CredentialedHttpClient(transport, settings, mapper);
        this.credentialsManager = new CredentialsManager(transport, hubTokenSource);
        this.defaultKind = config.getString("neurosync.source.default-kind");
        this.propertySpecs = AnnotationPropertySpec.fromConfig(config.getConfigList("neurosync.source.properties"));
        this.clock = clock;
    }

    public SourceParameters parse(String url) {
        return SourceParameters.parse(url, defaultKind);
    }

    /**
     * Parses a source URL and, if it names no user but an auth realm, takes the user from the
     * realm's token.
     */
    public CompletableFuture<SourceParameters> resolve(String url, CancellationToken cancellationToken) {
        SourceParameters parameters = parse(url);
        String realm = parameters.getAuthServer();
        if (parameters.getUser() != null || realm == null || realm.isEmpty()) {
            return CompletableFuture.completedFuture(parameters);
        }
        return credentialsManager.getCredentialsProvider(realm).get(cancellationToken)
            .thenApply(token -> {
                String user = TokenUsers.userFromToken(token, null).orElse(null);
                log.debug("Resolved session user {} from realm {}", user, realm);
                return parameters.toBuilder().authToken(token).user(user).build();
            });
    }

    /**
     * Resolves the dataset's imagery location from the backend's dataset listing.
     */
    public CompletableFuture<SourceParameters> complete(SourceParameters parameters,
                                                        CancellationToken cancellationToken) {
        return new DatasetCatalog(httpClient).complete(parameters, credentials(parameters), cancellationToken);
    }

    /**
     * Binds a collection to its encoders, its shared cache and its credentials.
     */
    public RemoteCollection open(SourceParameters parameters) {
        EncoderSet encoders = AnnotationEncoderFactory.create(parameters.getApi(), parameters.getKind(), mapper);
        AnnotationEndpoints endpoints = new AnnotationEndpoints(parameters);
        return new RemoteCollection(parameters, encoders, caches.forEndpoint(endpoints.listAllUrl()),
            httpClient, credentials(parameters), mapper);
    }

    public AnnotationSource annotationSource(RemoteCollection collection) {
        return new AnnotationSource(collection, clock);
    }

    public AnnotationChunkSource chunkSource(RemoteCollection collection) {
        return new AnnotationChunkSource(collection, propertySpecs);
    }

    public AnnotationCacheRegistry getCaches() {
        return caches;
    }

    public List<AnnotationPropertySpec> getPropertySpecs() {
        return propertySpecs;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    private ICredentialsProvider credentials(SourceParameters parameters) {
        return credentialsManager.getCredentialsProvider(parameters.getAuthServer());
    }
}
