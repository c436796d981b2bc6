package org.neurosync.source;

import org.neurosync.api.AnnotationValidationException;
import org.neurosync.credentials.AuthRealm;
import org.neurosync.credentials.TokenUsers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one remote annotation collection and the session that accesses it.
 * <p>
 * Parsed from source URLs of the form
 * {@code <scheme>://<host>/[<api>/]<dataset>[?token=..&auth=..&user=..&kind=..&groups=..&readonly=..]}.
 */
public final class SourceParameters {

    public static final String ATLAS_KIND = "Atlas";

    private static final Pattern URL_PATTERN =
        Pattern.compile("^([^/]+://[^/]+)/(?:([^/?#]+)/)?([^/?#]+)(?:[?#](.*))?$");

    private final String baseUrl;
    private final String api;
    private final String dataset;
    private final String kind;
    private final String user;
    private final String groups;
    private final String grayscale;
    private final String authServer;
    private final String authToken;
    private final boolean readonly;

    private SourceParameters(Builder builder) {
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl");
        this.dataset = Objects.requireNonNull(builder.dataset, "dataset");
        this.api = builder.api;
        this.kind = builder.kind;
        this.user = builder.user;
        this.groups = builder.groups;
        this.grayscale = builder.grayscale;
        this.authServer = builder.authServer;
        this.authToken = builder.authToken;
        this.readonly = builder.readonly;
    }

    /**
     * Parses a source URL.
     *
     * @param url         the source URL
     * @param defaultKind kind used when the URL names none
     * @throws AnnotationValidationException if the URL does not have the expected shape
     */
    public static SourceParameters parse(String url, String defaultKind) {
        Matcher matcher = url == null ? null : URL_PATTERN.matcher(url);
        if (matcher == null || !matcher.matches()) {
            throw new AnnotationValidationException("Invalid annotation source URL: " + url);
        }
        Builder builder = builder(matcher.group(1), matcher.group(3)).api(matcher.group(2));
        Map<String, String> query = parseQuery(matcher.group(4));

        String token = query.get("token");
        if (hasText(token)) {
            builder.authToken(token).authServer(AuthRealm.literal(token));
        } else if (hasText(query.get("auth"))) {
            builder.authServer(query.get("auth"));
        }

        String user = query.get("user");
        if (hasText(user)) {
            builder.user(user);
        } else if (hasText(token)) {
            builder.user(TokenUsers.userFromToken(token, null).orElse(null));
        }

        String kind = query.get("kind");
        if (hasText(kind)) {
            builder.kind("atlas".equals(kind) ? ATLAS_KIND : kind);
        } else {
            builder.kind(defaultKind);
        }

        if (hasText(query.get("groups"))) {
            builder.groups(query.get("groups"));
        }
        String readonly = query.get("readonly");
        builder.readonly("true".equalsIgnoreCase(readonly) || "1".equals(readonly));
        return builder.build();
    }

    private static Map<String, String> parseQuery(String query) {
        Map<String, String> result = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return result;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            result.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return result;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    public static Builder builder(String baseUrl, String dataset) {
        return new Builder().baseUrl(baseUrl).dataset(dataset);
    }

    public Builder toBuilder() {
        return new Builder()
            .baseUrl(baseUrl)
            .api(api)
            .dataset(dataset)
            .kind(kind)
            .user(user)
            .groups(groups)
            .grayscale(grayscale)
            .authServer(authServer)
            .authToken(authToken)
            .readonly(readonly);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return the API segment of the URL ({@code v2}, {@code v3}, ...), or {@code null}
     */
    public String getApi() {
        return api;
    }

    public String getDataset() {
        return dataset;
    }

    public String getKind() {
        return kind;
    }

    public boolean isAtlas() {
        return ATLAS_KIND.equals(kind);
    }

    /**
     * @return the session user, or {@code null} if the session is anonymous
     */
    public String getUser() {
        return user;
    }

    public String getGroups() {
        return groups;
    }

    /**
     * @return location of the imagery the collection is placed on, once resolved by
     *         {@link DatasetCatalog}
     */
    public String getGrayscale() {
        return grayscale;
    }

    /**
     * @return the authentication realm, see {@link AuthRealm}
     */
    public String getAuthServer() {
        return authServer;
    }

    public String getAuthToken() {
        return authToken;
    }

    public boolean isReadonly() {
        return readonly;
    }

    public boolean isAuthRefreshable() {
        return AuthRealm.isRefreshable(authServer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceParameters that)) {
            return false;
        }
        return readonly == that.readonly
            && baseUrl.equals(that.baseUrl)
            && Objects.equals(api, that.api)
            && dataset.equals(that.dataset)
            && Objects.equals(kind, that.kind)
            && Objects.equals(user, that.user)
            && Objects.equals(groups, that.groups)
            && Objects.equals(grayscale, that.grayscale)
            && Objects.equals(authServer, that.authServer)
            && Objects.equals(authToken, that.authToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseUrl, api, dataset, kind, user, groups, grayscale, authServer, authToken, readonly);
    }

    @Override
    public String toString() {
        return "SourceParameters{" +
            "baseUrl='" + baseUrl + '\'' +
            ", api='" + api + '\'' +
            ", dataset='" + dataset + '\'' +
            ", kind='" + kind + '\'' +
            ", user='" + user + '\'' +
            ", groups='" + groups + '\'' +
            ", readonly=" + readonly +
            '}';
    }

    public static final class Builder {
        private String baseUrl;
        private String api;
        private String dataset;
        private String kind;
        private String user;
        private String groups;
        private String grayscale;
        private String authServer;
        private String authToken;
        private boolean readonly;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder api(String api) {
            this.api = api;
            return this;
        }

        public Builder dataset(String dataset) {
            this.dataset = dataset;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder groups(String groups) {
            this.groups = groups;
            return this;
        }

        public Builder grayscale(String grayscale) {
            this.grayscale = grayscale;
            return this;
        }

        public Builder authServer(String authServer) {
            this.authServer = authServer;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder readonly(boolean readonly) {
            this.readonly = readonly;
            return this;
        }

        public SourceParameters build() {
            return new SourceParameters(this);
        }
    }
}
