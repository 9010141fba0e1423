package tech.tokenstore.store;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.jboss.logging.Logger;
import tech.tokenstore.shared.TokenStoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Creates the token collections and their TTL indexes.
 *
 * Every record collection carries exactly one TTL index on {@code expiresAt},
 * so MongoDB reaps expired grants without a sweeper. Both steps are idempotent:
 * an existing collection is reused, and an expiry index with stale options is
 * replaced. Any other failure is raised to the caller.
 */
public class ExpiryIndexInitializer {

    private static final Logger LOG = Logger.getLogger(ExpiryIndexInitializer.class);

    static final String INDEX_NAME = "expire_after";

    static final int NAMESPACE_EXISTS = 48;
    static final int INDEX_OPTIONS_CONFLICT = 85;
    static final int INDEX_KEY_SPECS_CONFLICT = 86;

    private final MongoDatabase database;
    private final long expireAfterSeconds;

    public ExpiryIndexInitializer(MongoDatabase database, Duration expireAfter) {
        this.database = database;
        this.expireAfterSeconds = expireAfter.toSeconds();
    }

    public void initialize(List<String> collectionNames) {
        LOG.infof("Initializing token collections %s (expireAfterSeconds=%d)", collectionNames, expireAfterSeconds);
        for (String name : collectionNames) {
            ensureCollection(name);
            ensureExpiryIndex(name);
        }
        LOG.info("Token collections initialized");
    }

    private void ensureCollection(String name) {
        try {
            database.createCollection(name);
            LOG.infof("Created collection %s", name);
        } catch (MongoCommandException e) {
            if (e.getErrorCode() != NAMESPACE_EXISTS) {
                throw new TokenStoreException("Failed to create collection " + name, e);
            }
            LOG.debugf("Collection %s already exists", name);
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to create collection " + name, e);
        }
    }

    private void ensureExpiryIndex(String name) {
        MongoCollection<Document> collection = database.getCollection(name);
        try {
            createExpiryIndex(collection);
        } catch (MongoCommandException e) {
            if (e.getErrorCode() != INDEX_OPTIONS_CONFLICT && e.getErrorCode() != INDEX_KEY_SPECS_CONFLICT) {
                throw new TokenStoreException("Failed to create expiry index on " + name, e);
            }
            LOG.warnf("Replacing expiry index on %s: %s", name, e.getErrorMessage());
            replaceExpiryIndex(collection, name);
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to create expiry index on " + name, e);
        }
    }

    private void replaceExpiryIndex(MongoCollection<Document> collection, String name) {
        try {
            for (Document index : collection.listIndexes().into(new ArrayList<>())) {
                if (isExpiryIndex(index)) {
                    String indexName = index.getString("name");
                    collection.dropIndex(indexName);
                    LOG.infof("Dropped index %s on %s", indexName, name);
                }
            }
            createExpiryIndex(collection);
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to replace expiry index on " + name, e);
        }
    }

    private void createExpiryIndex(MongoCollection<Document> collection) {
        collection.createIndex(
            Indexes.ascending(RecordFields.EXPIRES_AT),
            new IndexOptions()
                .name(INDEX_NAME)
                .unique(false)
                .sparse(false)
                .expireAfter(expireAfterSeconds, TimeUnit.SECONDS));
    }

    private static boolean isExpiryIndex(Document index) {
        if (INDEX_NAME.equals(index.getString("name"))) {
            return true;
        }
        Document key = index.get("key", Document.class);
        return key != null && key.size() == 1 && key.containsKey(RecordFields.EXPIRES_AT);
    }
}
