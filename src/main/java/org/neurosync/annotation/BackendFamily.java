package org.neurosync.annotation;

/**
 * The two incompatible remote annotation services.
 * <p>
 * {@link #A} speaks the flat v1 schema, where identity is purely geometric.
 * {@link #B} speaks the v2/v3 envelope schema, where the author is part of the identity.
 */
public enum BackendFamily {
    A,
    B;

    /**
     * Selects the family from the API segment of a source URL: {@code v2}, {@code v3} and
     * {@code test} use family B, everything else (including no API) uses family A.
     */
    public static BackendFamily forApi(String api) {
        if (api == null) {
            return A;
        }
        return switch (api) {
            case "v2", "v3", "test" -> B;
            default -> A;
        };
    }
}
