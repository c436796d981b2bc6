package org.neurosync.credentials;

import org.neurosync.http.IHttpTransport;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link ICredentialsProvider} per realm string, created on first use.
 */
public class CredentialsManager {

    private final Map<String, ICredentialsProvider> providers = new ConcurrentHashMap<>();
    private final IHttpTransport transport;
    private final IHubTokenSource hubTokenSource;

    public CredentialsManager(IHttpTransport transport, IHubTokenSource hubTokenSource) {
        this.transport = transport;
        this.hubTokenSource = hubTokenSource;
    }

    public ICredentialsProvider getCredentialsProvider(String realm) {
        String key = realm == null ? "" : realm;
        return providers.computeIfAbsent(key,
            r -> new RealmCredentialsProvider(AuthRealm.parse(r), transport, hubTokenSource));
    }
}
