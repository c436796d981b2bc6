package org.neurosync.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-known raw backend entries of one remote collection, keyed by annotation id.
 * <p>
 * The cache holds the server representation rather than decoded annotations so that
 * ownership and overwrite checks compare against exactly what the server last acknowledged.
 * <p>
 * <strong>Thread Safety:</strong> All operations are safe for concurrent use. Writes to the
 * same id are not serialized; the last completed write wins.
 */
public class AnnotationCache {

    private final String endpoint;
    private final ConcurrentHashMap<String, ObjectNode> entries = new ConcurrentHashMap<>();

    AnnotationCache(String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return the list-all URL this cache belongs to
     */
    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Stores a copy of {@code entry} under {@code id}. Empty ids are ignored.
     */
    public void add(String id, ObjectNode entry) {
        if (id == null || id.isEmpty() || entry == null) {
            return;
        }
        entries.put(id, entry.deepCopy());
    }

    /**
     * Same as {@link #add(String, ObjectNode)}; last write wins.
     */
    public void update(String id, ObjectNode entry) {
        add(id, entry);
    }

    public void remove(String id) {
        if (id != null) {
            entries.remove(id);
        }
    }

    /**
     * @return the cached entry; callers must not modify it
     */
    public Optional<ObjectNode> getValue(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public Set<String> ids() {
        return Set.copyOf(entries.keySet());
    }
}
