package org.neurosync.credentials;

import java.util.Objects;

/**
 * Parsed form of a realm string.
 * <ul>
 *   <li>empty or {@code null}: no credentials</li>
 *   <li>{@code token:<literal>}: a fixed token, never refreshable</li>
 *   <li>{@code neurohub}: the hub realm, refreshable through {@link IHubTokenSource}</li>
 *   <li>{@code http://...} or {@code https://...}: a URL answering with the token text, refreshable</li>
 * </ul>
 * Anything else is {@link Kind#UNSUPPORTED}.
 */
public final class AuthRealm {

    public static final String HUB_REALM = "neurohub";
    public static final String TOKEN_PREFIX = "token:";

    public enum Kind {
        NONE,
        LITERAL_TOKEN,
        HUB,
        URL,
        UNSUPPORTED
    }

    private final Kind kind;
    private final String realm;

    private AuthRealm(Kind kind, String realm) {
        this.kind = kind;
        this.realm = realm;
    }

    public static AuthRealm parse(String realm) {
        if (realm == null || realm.isEmpty()) {
            return new AuthRealm(Kind.NONE, "");
        }
        if (realm.startsWith(TOKEN_PREFIX)) {
            return new AuthRealm(Kind.LITERAL_TOKEN, realm);
        }
        if (HUB_REALM.equals(realm)) {
            return new AuthRealm(Kind.HUB, realm);
        }
        if (realm.startsWith("http://") || realm.startsWith("https://")) {
            return new AuthRealm(Kind.URL, realm);
        }
        return new AuthRealm(Kind.UNSUPPORTED, realm);
    }

    public static String literal(String token) {
        return TOKEN_PREFIX + token;
    }

    /**
     * Whether an auth failure can be recovered by acquiring a new token.
     */
    public static boolean isRefreshable(String realm) {
        return parse(realm).isRefreshable();
    }

    public boolean isRefreshable() {
        return kind == Kind.HUB || kind == Kind.URL;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRealm() {
        return realm;
    }

    /**
     * @return the literal token for {@link Kind#LITERAL_TOKEN}, otherwise {@code null}
     */
    public String getLiteralToken() {
        return kind == Kind.LITERAL_TOKEN ? realm.substring(TOKEN_PREFIX.length()) : null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AuthRealm that && kind == that.kind && realm.equals(that.realm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, realm);
    }

    @Override
    public String toString() {
        // Literal realms carry a secret.
        return kind == Kind.LITERAL_TOKEN ? "token:***" : realm;
    }
}
