package org.neurosync.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link AnnotationCache} per remote endpoint.
 * <p>
 * Create a single registry per application session and hand it to every source. Caches are
 * created lazily on first use of an endpoint and live until {@link #evict(String)} or
 * {@link #clear()} is called, so sources opened repeatedly for the same endpoint share state.
 */
public final class AnnotationCacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnnotationCacheRegistry.class);

    private final Map<String, AnnotationCache> caches = new ConcurrentHashMap<>();

    /**
     * Returns the cache for an endpoint, creating it on first use.
     *
     * @param endpoint the canonical list-all URL of the collection
     */
    public AnnotationCache forEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isEmpty()) {
            throw new IllegalArgumentException("endpoint must not be empty");
        }
        return caches.computeIfAbsent(endpoint, url -> {
            log.debug("Creating annotation cache for endpoint {}", url);
            return new AnnotationCache(url);
        });
    }

    /**
     * Drops the cache of an endpoint; the next access creates a fresh one.
     */
    public void evict(String endpoint) {
        if (caches.remove(endpoint) != null) {
            log.debug("Evicted annotation cache for endpoint {}", endpoint);
        }
    }

    public void clear() {
        caches.clear();
    }

    public Set<String> endpoints() {
        return Set.copyOf(caches.keySet());
    }
}
