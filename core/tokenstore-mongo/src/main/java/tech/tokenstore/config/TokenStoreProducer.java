package tech.tokenstore.config;

import com.mongodb.client.MongoClient;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.tokenstore.store.MongoTokenStore;
import tech.tokenstore.store.TokenCollections;
import tech.tokenstore.store.TokenStore;
import tech.tokenstore.store.TokenStoreSettings;

import java.time.Duration;

/**
 * CDI producer that builds the TokenStore from the Quarkus-managed MongoClient
 * and the token-store configuration. The store is created at startup so
 * collection and expiry index setup failures stop the application.
 */
@ApplicationScoped
public class TokenStoreProducer {

    private static final Logger LOG = Logger.getLogger(TokenStoreProducer.class);

    @Inject
    MongoClient mongoClient;

    @Inject
    TokenStoreConfig config;

    @Produces
    @Singleton
    @Startup
    public TokenStore produceTokenStore() {
        TokenCollections collections = collections(config);
        TokenStoreSettings settings = settings(config);
        LOG.infof("Configuring MongoDB token store on database %s (keyEncoding=%s)",
            config.database(), settings.keyEncoding());

        return new MongoTokenStore(mongoClient, config.database(), collections, settings);
    }

    void closeTokenStore(@Disposes TokenStore store) {
        store.close();
    }

    static TokenCollections collections(TokenStoreConfig config) {
        TokenStoreConfig.Collections names = config.collections();
        return new TokenCollections(names.txn(), names.basic(), names.access(), names.refresh());
    }

    static TokenStoreSettings settings(TokenStoreConfig config) {
        return new TokenStoreSettings(
            config.keyEncoding(),
            Duration.ofSeconds(config.expireAfterSeconds()),
            config.operationTimeout());
    }
}
