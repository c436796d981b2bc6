package org.neurosync.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.api.AnnotationValidationException;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses structured metadata embedded in free text with the {@code ${<json>:JSON}} syntax.
 */
public final class DescriptionSentinel {

    private static final Pattern SENTINEL = Pattern.compile("^\\$\\{(.*):JSON}$", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public DescriptionSentinel(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static boolean matches(String description) {
        return description != null && SENTINEL.matcher(description).matches();
    }

    /**
     * @param description free text, possibly {@code null}
     * @return the embedded JSON object, or empty if the text is not a sentinel
     * @throws AnnotationValidationException if the text is a sentinel but its JSON is not an object
     */
    public Optional<Map<String, Object>> parse(String description) {
        if (description == null) {
            return Optional.empty();
        }
        Matcher matcher = SENTINEL.matcher(description);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, Object> parsed;
        try {
            parsed = mapper.readValue(matcher.group(1), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new AnnotationValidationException("Invalid JSON in description: " + e.getOriginalMessage(), e);
        }
        if (parsed == null) {
            throw new AnnotationValidationException("Description JSON is not an object: " + matcher.group(1));
        }
        return Optional.of(parsed);
    }
}
