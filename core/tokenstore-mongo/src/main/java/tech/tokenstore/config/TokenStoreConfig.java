package tech.tokenstore.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.tokenstore.store.KeyEncoding;

import java.time.Duration;

/**
 * Configuration for the MongoDB token store.
 */
@ConfigMapping(prefix = "token-store")
public interface TokenStoreConfig {

    /**
     * MongoDB database holding the token collections.
     */
    @WithDefault("oauth2")
    String database();

    Collections collections();

    /**
     * How token values are stored as document keys.
     * OBJECT_ID rejects tokens that are not 24 character hex strings.
     */
    @WithDefault("STRING")
    KeyEncoding keyEncoding();

    /**
     * Seconds the TTL monitor waits past expiresAt before deleting a record.
     */
    @WithDefault("1")
    long expireAfterSeconds();

    /**
     * Upper bound for a single read or transaction commit.
     * Supports duration format: 10s, 500ms, etc.
     */
    @WithDefault("10s")
    Duration operationTimeout();

    interface Collections {

        @WithDefault("oauth2_txn")
        String txn();

        @WithDefault("oauth2_basic")
        String basic();

        @WithDefault("oauth2_access")
        String access();

        @WithDefault("oauth2_refresh")
        String refresh();
    }
}
