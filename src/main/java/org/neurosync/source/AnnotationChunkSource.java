package org.neurosync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.encoding.IAnnotationEncoder;
import org.neurosync.http.CancellationToken;
import org.neurosync.http.HttpCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Bulk download of a whole collection.
 * <p>
 * Each download is a full resync: the collection's cache is cleared, the list-all URL is
 * fetched once, and every entry that decodes is cached, packed into the chunk and optionally
 * announced to listeners. Entries that fail to decode are logged and skipped.
 */
public class AnnotationChunkSource {

    private static final Logger log = LoggerFactory.getLogger(AnnotationChunkSource.class);

    /** Family A kind of placeholder elements that carry no annotation. */
    static final String UNKNOWN_KIND = "Unknown";

    private final RemoteCollection collection;
    private final List<AnnotationPropertySpec> propertySpecs;

    public AnnotationChunkSource(RemoteCollection collection, List<AnnotationPropertySpec> propertySpecs) {
        this.collection = collection;
        this.propertySpecs = List.copyOf(propertySpecs);
    }

    /**
     * Downloads the collection.
     *
     * @param emitAddSignals whether to publish {@code childAdded} for each decoded annotation
     */
    public CompletableFuture<AnnotationGeometryChunk> download(boolean emitAddSignals,
                                                               CancellationToken cancellationToken) {
        collection.getCache().clear();
        String url = collection.getEndpoints().listAllUrl();
        CompletableFuture<AnnotationGeometryChunk> result = collection.getHttpClient()
            .requestJson(collection.getCredentials(), collection.getParameters().isAuthRefreshable(),
                HttpCall.get(url), cancellationToken)
            .thenApply(response -> parseAnnotations(response, emitAddSignals));
        return cancellationToken.bind(result);
    }

    AnnotationGeometryChunk parseAnnotations(JsonNode response, boolean emitAddSignals) {
        List<Map.Entry<String, JsonNode>> entries = entriesOf(response);
        AnnotationSerializer serializer = new AnnotationSerializer(propertySpecs);
        List<Annotation> decoded = new ArrayList<>();
        int lastIndex = entries.size() - 1;

        for (int index = 0; index < entries.size(); index++) {
            Map.Entry<String, JsonNode> entry = entries.get(index);
            if (!entry.getValue().isObject()) {
                log.warn("Skipping non-object entry '{}'", entry.getKey());
                continue;
            }
            ObjectNode raw = (ObjectNode) entry.getValue();
            JsonNode explicitKey = raw.path("key");
            String key = explicitKey.isTextual() && !explicitKey.asText().isEmpty() ? explicitKey.asText() : entry.getKey();

            if (collection.getEncoders().getFamily() == BackendFamily.A && UNKNOWN_KIND.equals(raw.path("Kind").asText())) {
                log.debug("Skipping element '{}' of unknown kind", key);
                continue;
            }

            Optional<AnnotationType> type = AnnotationIds.typeOf(key);
            Optional<IAnnotationEncoder> encoder = type.flatMap(collection.getEncoders()::forType);
            if (encoder.isEmpty()) {
                log.warn("Skipping entry with unsupported key '{}'", key);
                continue;
            }

            ObjectNode prepared = encoder.get().withDefaultDiscriminant(raw, collection.getParameters().getKind());
            Optional<Annotation> annotation = encoder.get().decode(key, prepared);
            if (annotation.isEmpty()) {
                continue;
            }

            String sourceTag = index == lastIndex ? "downloaded:last" : "downloaded:" + index + "/" + lastIndex;
            Annotation tagged = annotation.get().withSource(sourceTag);
            String id = AnnotationIds.deriveId(tagged, collection.getEncoders().getFamily());
            collection.getCache().add(id, prepared);
            serializer.add(tagged.withId(id));
            decoded.add(tagged.withId(id));
            if (emitAddSignals) {
                collection.getListeners().childAdded(tagged.withId(id));
            }
        }

        log.debug("Decoded {} of {} entries from {}", decoded.size(), entries.size(),
            collection.getEndpoints().listAllUrl());
        return new AnnotationGeometryChunk(serializer.serialize(), decoded);
    }

    /**
     * Backends answer with an object keyed by annotation key, with an array of elements, or
     * with an object whose values are arrays of elements.
     */
    private List<Map.Entry<String, JsonNode>> entriesOf(JsonNode response) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        if (response == null) {
            return entries;
        }
        if (response.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isArray()) {
                    addElements(entries, field.getValue());
                } else {
                    entries.add(field);
                }
            }
        } else if (response.isArray()) {
            addElements(entries, response);
        }
        return entries;
    }

    private void addElements(List<Map.Entry<String, JsonNode>> entries, JsonNode elements) {
        for (JsonNode element : elements) {
            entries.add(new AbstractMap.SimpleImmutableEntry<>(elementKey(element, entries.size()), element));
        }
    }

    /**
     * Family A elements are keyed by their {@code Pos} (or {@code location}); anything else
     * falls back to its position in the response.
     */
    private String elementKey(JsonNode element, int index) {
        if (collection.getEncoders().getFamily() == BackendFamily.A) {
            JsonNode pos = element.has("location") ? element.get("location") : element.path("Pos");
            if (pos.isArray() && pos.size() == 3
                && pos.get(0).isIntegralNumber() && pos.get(1).isIntegralNumber() && pos.get(2).isIntegralNumber()) {
                return pos.get(0).asLong() + "_" + pos.get(1).asLong() + "_" + pos.get(2).asLong();
            }
        }
        return String.valueOf(index);
    }
}
