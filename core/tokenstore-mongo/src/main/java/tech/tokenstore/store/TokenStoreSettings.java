package tech.tokenstore.store;

import java.time.Duration;

/**
 * Behavioural settings for {@link MongoTokenStore}.
 *
 * @param keyEncoding      how token values are stored as keys
 * @param expireAfter      delay the TTL index adds on top of {@code expiresAt}
 * @param operationTimeout upper bound for reads and transaction commits
 */
public record TokenStoreSettings(KeyEncoding keyEncoding, Duration expireAfter, Duration operationTimeout) {

    public static final Duration DEFAULT_EXPIRE_AFTER = Duration.ofSeconds(1);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(10);

    public TokenStoreSettings {
        if (keyEncoding == null) {
            throw new IllegalArgumentException("Key encoding must be set");
        }
        if (expireAfter == null || expireAfter.isNegative()) {
            throw new IllegalArgumentException("Expire-after delay must be zero or positive");
        }
        if (operationTimeout == null || operationTimeout.isZero() || operationTimeout.isNegative()) {
            throw new IllegalArgumentException("Operation timeout must be positive");
        }
    }

    public static TokenStoreSettings defaults() {
        return new TokenStoreSettings(KeyEncoding.STRING, DEFAULT_EXPIRE_AFTER, DEFAULT_OPERATION_TIMEOUT);
    }

    public TokenStoreSettings withKeyEncoding(KeyEncoding encoding) {
        return new TokenStoreSettings(encoding, expireAfter, operationTimeout);
    }
}
