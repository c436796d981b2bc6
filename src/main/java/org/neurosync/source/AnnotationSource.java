package org.neurosync.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.annotation.DescriptionSentinel;
import org.neurosync.api.AnnotationSyncException;
import org.neurosync.api.AnnotationValidationException;
import org.neurosync.api.ConflictException;
import org.neurosync.api.EncodeException;
import org.neurosync.api.IAnnotationListener;
import org.neurosync.api.PermissionException;
import org.neurosync.cache.AnnotationCache;
import org.neurosync.encoding.IAnnotationEncoder;
import org.neurosync.http.CancellationToken;
import org.neurosync.http.HttpCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Create, update, delete and metadata lookup for a remote annotation collection.
 * <p>
 * Every write is a short request lifecycle:
 * <ul>
 *   <li><strong>add</strong> stamps timestamp, user and point kind, rounds and recomputes the
 *       annotation, then writes it without overwrite.</li>
 *   <li><strong>update</strong> writes with overwrite. The write encodes the annotation,
 *       checks the cache for conflicts, stores the raw entry and posts it if the encoder
 *       deems it uploadable.</li>
 *   <li><strong>delete</strong> checks ownership against the cached entry, then deletes
 *       remotely if uploadable and locally after confirmation.</li>
 * </ul>
 * Ownership and conflict checks run against the local cache only. The backends offer no
 * compare-and-swap, so concurrent sessions editing the same annotation can overwrite each
 * other.
 * <p>
 * <strong>Thread Safety:</strong> Operations may run concurrently. Writes to the same id race
 * and the last completion wins.
 */
public class AnnotationSource {

    private static final Logger log = LoggerFactory.getLogger(AnnotationSource.class);

    static final String READONLY_MESSAGE = "Permission denied for changing annotations.";
    static final String DEFAULT_POINT_KIND = "Note";

    private final RemoteCollection collection;
    private final DescriptionSentinel sentinel;
    private final Clock clock;

    public AnnotationSource(RemoteCollection collection, Clock clock) {
        this.collection = collection;
        this.sentinel = new DescriptionSentinel(collection.getMapper());
        this.clock = clock;
    }

    public void addListener(IAnnotationListener listener) {
        collection.getListeners().add(listener);
    }

    public void removeListener(IAnnotationListener listener) {
        collection.getListeners().remove(listener);
    }

    /**
     * Creates an annotation.
     *
     * @return the id of the stored annotation, built from the key the backend acknowledged
     */
    public CompletableFuture<String> add(Annotation annotation, CancellationToken cancellationToken) {
        try {
            requireWritable();
            Annotation prepared = prepareNew(annotation);
            return updateAnnotation(prepared, false, cancellationToken).thenApply(WriteAcknowledgement::id);
        } catch (AnnotationSyncException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Replaces the annotation stored under {@code id}.
     */
    public CompletableFuture<WriteAcknowledgement> update(String id, Annotation annotation,
                                                          CancellationToken cancellationToken) {
        try {
            requireWritable();
            Annotation candidate = annotation;
            if (candidate.getKey() != null
                && !AnnotationIds.deriveId(candidate, family()).equals(id)) {
                // A moved annotation no longer lives under its old key.
                candidate = candidate.withKey(null);
            }
            Annotation prepared = candidate.rounded().recomputed();
            return updateAnnotation(prepared, true, cancellationToken)
                .thenApply(ack -> {
                    collection.getListeners().childUpdated(prepared.withId(ack.id()));
                    return ack;
                });
        } catch (AnnotationSyncException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Deletes an annotation. Ids that do not denote an annotation complete normally without
     * doing anything.
     */
    public CompletableFuture<Void> delete(String id, CancellationToken cancellationToken) {
        try {
            requireWritable();
            if (!AnnotationIds.isValid(id)) {
                log.debug("Ignoring delete of invalid id '{}'", id);
                return CompletableFuture.completedFuture(null);
            }
            AnnotationCache cache = collection.getCache();
            Optional<ObjectNode> cached = cache.getValue(id);
            String owner = cached.map(entry -> entry.path("user").asText("")).orElse("");
            if (!owner.isEmpty() && !owner.equals(collection.getParameters().getUser())) {
                throw new PermissionException("Unable to delete annotation owned by " + owner + ".");
            }

            if (!uploadable(id, cached)) {
                cache.remove(id);
                collection.getListeners().childDeleted(id);
                return CompletableFuture.completedFuture(null);
            }

            String url = collection.getEndpoints().deleteUrl(AnnotationIds.keyOf(id));
            SourceParameters parameters = collection.getParameters();
            CompletableFuture<Void> result = collection.getHttpClient()
                .request(collection.getCredentials(), parameters.isAuthRefreshable(), HttpCall.delete(url), cancellationToken)
                .thenRun(() -> {
                    cache.remove(id);
                    log.debug("Deleted annotation {}", id);
                    collection.getListeners().childDeleted(id);
                });
            return cancellationToken.bind(result);
        } catch (AnnotationSyncException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Looks an annotation up in the cache filled by the last bulk download and local writes.
     * No network call is made.
     *
     * @return the annotation, or empty if it is not known
     * @throws AnnotationValidationException if {@code id} does not denote an annotation
     */
    public Optional<Annotation> getMetadata(String id) {
        AnnotationType type = AnnotationIds.requireType(id);
        return collection.getCache().getValue(id)
            .flatMap(entry -> collection.getEncoders().forType(type)
                .flatMap(encoder -> encoder.decode(AnnotationIds.keyOf(id), entry)));
    }

    private Annotation prepareNew(Annotation annotation) {
        SourceParameters parameters = collection.getParameters();
        Annotation prepared = annotation.withTimestamp(clock.millis());
        if (parameters.getUser() != null) {
            prepared = prepared.withUser(parameters.getUser());
        }
        if (prepared.getType() == AnnotationType.POINT) {
            String kind = parameters.getKind() != null ? parameters.getKind() : DEFAULT_POINT_KIND;
            prepared = prepared.withKind(prepared.getKind() != null ? prepared.getKind() : kind);
            String description = annotation.getDescription();
            if (description != null && !description.isEmpty() && !description.equals(prepared.getPresentation())) {
                Optional<Map<String, Object>> embedded = sentinel.parse(description);
                prepared = embedded.isPresent() ? prepared.withProp(embedded.get()) : prepared.withComment(description);
            }
        }
        return prepared.rounded().recomputed();
    }

    private CompletableFuture<WriteAcknowledgement> updateAnnotation(Annotation annotation, boolean overwrite,
                                                                     CancellationToken cancellationToken) {
        SourceParameters parameters = collection.getParameters();
        String user = parameters.getUser();
        if (user == null || user.isEmpty()) {
            throw new AnnotationValidationException("Cannot upload an annotation without a user");
        }
        String owner = annotation.getUser();
        if (owner != null && !owner.isEmpty() && !owner.equals(user)) {
            throw new PermissionException("Unable to change annotation owned by " + owner + ".");
        }

        Annotation stamped = annotation.withUser(user);
        IAnnotationEncoder encoder = collection.getEncoders().forType(stamped.getType())
            .orElseThrow(() -> new EncodeException(stamped.getType() + " annotations are not supported by this source"));
        ObjectNode encoded = encoder.encode(stamped)
            .orElseThrow(() -> new EncodeException("Unable to encode the annotation"));

        BackendFamily family = family();
        String id = AnnotationIds.deriveId(stamped, family);
        String key = AnnotationIds.deriveKey(stamped, family);
        AnnotationCache cache = collection.getCache();
        if (!overwrite && cache.contains(id)) {
            throw new ConflictException(id);
        }
        cache.update(id, encoded);

        if (!encoder.uploadable(stamped)) {
            log.debug("Keeping annotation {} local, it is not uploadable", id);
            return CompletableFuture.completedFuture(new WriteAcknowledgement(id, key, false));
        }

        String payload = writeJson(encoded);
        String url = collection.getEndpoints().postUrl(stamped.getPointA());
        CompletableFuture<WriteAcknowledgement> result = collection.getHttpClient()
            .requestText(collection.getCredentials(), parameters.isAuthRefreshable(), HttpCall.post(url, payload),
                cancellationToken)
            .thenApply(body -> {
                String acknowledgedKey = acknowledgedKey(body, key);
                String acknowledgedId = AnnotationIds.deriveId(stamped, family, acknowledgedKey);
                if (!acknowledgedId.equals(id)) {
                    cache.remove(id);
                    cache.update(acknowledgedId, encoded);
                }
                log.debug("Stored annotation {}", acknowledgedId);
                return new WriteAcknowledgement(acknowledgedId, acknowledgedKey, true);
            });
        return cancellationToken.bind(result);
    }

    private boolean uploadable(String id, Optional<ObjectNode> cached) {
        Optional<IAnnotationEncoder> encoder = collection.getEncoders().forId(id);
        if (encoder.isEmpty()) {
            return false;
        }
        IAnnotationEncoder e = encoder.get();
        return cached.flatMap(entry -> e.decode(AnnotationIds.keyOf(id), entry))
            .map(e::uploadable)
            .orElseGet(() -> e.uploadableById(id));
    }

    /**
     * The backend answers a write with the bare key, a JSON string or an object carrying
     * {@code key}; anything else keeps the derived key.
     */
    private String acknowledgedKey(String body, String derivedKey) {
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.isEmpty()) {
            return derivedKey;
        }
        try {
            JsonNode node = collection.getMapper().readTree(trimmed);
            if (node.isTextual() && !node.asText().isEmpty()) {
                return node.asText();
            }
            JsonNode key = node.path("key");
            return key.isTextual() && !key.asText().isEmpty() ? key.asText() : derivedKey;
        } catch (JsonProcessingException e) {
            return trimmed;
        }
    }

    private String writeJson(ObjectNode encoded) {
        try {
            return collection.getMapper().writeValueAsString(encoded);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Unable to serialize the annotation: " + e.getOriginalMessage());
        }
    }

    private BackendFamily family() {
        return collection.getEncoders().getFamily();
    }

    private void requireWritable() {
        if (collection.getParameters().isReadonly()) {
            throw new PermissionException(READONLY_MESSAGE);
        }
    }
}
