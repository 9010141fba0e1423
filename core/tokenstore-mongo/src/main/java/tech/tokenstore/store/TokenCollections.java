package tech.tokenstore.store;

import java.util.List;

/**
 * Collection names used by the token store.
 *
 * @param txn     reserved for transaction bookkeeping, not written by the store
 * @param basic   primary grant records
 * @param access  access token index records
 * @param refresh refresh token index records
 */
public record TokenCollections(String txn, String basic, String access, String refresh) {

    public static final String DEFAULT_TXN = "oauth2_txn";
    public static final String DEFAULT_BASIC = "oauth2_basic";
    public static final String DEFAULT_ACCESS = "oauth2_access";
    public static final String DEFAULT_REFRESH = "oauth2_refresh";

    public TokenCollections {
        requireName(basic, "basic");
        requireName(access, "access");
        requireName(refresh, "refresh");
        if (basic.equals(access) || basic.equals(refresh) || access.equals(refresh)) {
            throw new IllegalArgumentException(
                "Basic, access and refresh collections must be distinct: " + basic + ", " + access + ", " + refresh);
        }
    }

    public static TokenCollections defaults() {
        return new TokenCollections(DEFAULT_TXN, DEFAULT_BASIC, DEFAULT_ACCESS, DEFAULT_REFRESH);
    }

    /**
     * The collections that hold records and carry an expiry index.
     */
    public List<String> recordCollections() {
        return List.of(basic, access, refresh);
    }

    private static void requireName(String name, String role) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name for " + role + " records must not be blank");
        }
    }
}
