package org.neurosync.encoding;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.api.AnnotationValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Common plumbing for encoders: field verification helpers and the decode error boundary.
 * <p>
 * Subclasses implement {@link #decodeEntry(String, ObjectNode)} and may throw
 * {@link AnnotationValidationException} freely; {@link #decode(String, ObjectNode)} turns
 * such failures into an empty result and a log line.
 */
public abstract class AbstractAnnotationEncoder implements IAnnotationEncoder {

    private static final Logger log = LoggerFactory.getLogger(AbstractAnnotationEncoder.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final ObjectMapper mapper;
    private final BackendFamily family;
    private final AnnotationType type;
    private final boolean sendingToServer;

    protected AbstractAnnotationEncoder(ObjectMapper mapper, BackendFamily family, AnnotationType type,
                                        boolean sendingToServer) {
        this.mapper = mapper;
        this.family = family;
        this.type = type;
        this.sendingToServer = sendingToServer;
    }

    @Override
    public BackendFamily getFamily() {
        return family;
    }

    @Override
    public AnnotationType getType() {
        return type;
    }

    @Override
    public final Optional<Annotation> decode(String key, ObjectNode entry) {
        if (entry == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(decodeEntry(key, entry));
        } catch (AnnotationValidationException | IllegalArgumentException e) {
            log.warn("Skipping undecodable {} entry '{}': {}", type, key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean uploadable(Annotation annotation) {
        return sendingToServer;
    }

    @Override
    public boolean uploadableById(String id) {
        return sendingToServer;
    }

    /**
     * Decodes an entry, throwing on any schema mismatch.
     */
    protected abstract Annotation decodeEntry(String key, ObjectNode entry);

    protected static String requireString(ObjectNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            throw new AnnotationValidationException("Missing required field '" + field + "'");
        }
        if (!node.isTextual()) {
            throw new AnnotationValidationException("Expected string for '" + field + "', got " + node.getNodeType());
        }
        return node.asText();
    }

    protected static String optionalString(ObjectNode entry, String field) {
        if (!entry.hasNonNull(field)) {
            return null;
        }
        return requireString(entry, field);
    }

    protected static Boolean optionalBoolean(ObjectNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            throw new AnnotationValidationException("Expected boolean for '" + field + "', got " + node.getNodeType());
        }
        return node.asBoolean();
    }

    protected Map<String, Object> optionalObject(ObjectNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new AnnotationValidationException("Expected object for '" + field + "', got " + node.getNodeType());
        }
        return new LinkedHashMap<>(mapper.convertValue(node, MAP_TYPE));
    }

    /**
     * Reads an array of exactly {@code length} integers.
     */
    protected static long[] requireIntVector(ObjectNode entry, String field, int length) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            throw new AnnotationValidationException("Missing required field '" + field + "'");
        }
        if (!node.isArray() || node.size() != length) {
            throw new AnnotationValidationException(
                "Expected array of " + length + " integers for '" + field + "', got " + node);
        }
        long[] values = new long[length];
        for (int i = 0; i < length; i++) {
            JsonNode element = node.get(i);
            if (!element.isNumber() || element.asDouble() != Math.rint(element.asDouble())) {
                throw new AnnotationValidationException("Expected integer at " + field + "[" + i + "], got " + element);
            }
            values[i] = element.asLong();
        }
        return values;
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
