package org.neurosync.credentials;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads the user identity out of a JWT bearer token.
 */
public final class TokenUsers {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TokenUsers() {
        // Utility class
    }

    /**
     * Resolves the session user.
     *
     * @param token       bearer token, may be {@code null} or opaque
     * @param defaultUser user requested explicitly, may be {@code null}
     * @return the token's {@code user} (else {@code email}) claim; {@code defaultUser} when the
     *         token names nobody; empty when both are set and disagree
     */
    public static Optional<String> userFromToken(String token, String defaultUser) {
        Optional<String> tokenUser = claimedUser(token);
        if (tokenUser.isEmpty()) {
            return Optional.ofNullable(defaultUser).filter(u -> !u.isEmpty());
        }
        if (defaultUser != null && !defaultUser.isEmpty() && !defaultUser.equals(tokenUser.get())) {
            return Optional.empty();
        }
        return tokenUser;
    }

    static Optional<String> claimedUser(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            JsonNode payload = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            for (String field : new String[] {"user", "email"}) {
                JsonNode value = payload.get(field);
                if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                    return Optional.of(value.asText());
                }
            }
            return Optional.empty();
        } catch (IllegalArgumentException | IOException e) {
            return Optional.empty();
        }
    }
}
