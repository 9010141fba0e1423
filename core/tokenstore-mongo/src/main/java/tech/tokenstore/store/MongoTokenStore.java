package tech.tokenstore.store;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.ReadConcern;
import com.mongodb.TransactionOptions;
import com.mongodb.WriteConcern;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;
import tech.tokenstore.grant.GrantCodec;
import tech.tokenstore.grant.TokenGrant;
import tech.tokenstore.shared.TokenStoreException;
import tech.tokenstore.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB implementation of TokenStore.
 *
 * A grant is split across three collections:
 * - basic: the encoded grant, keyed by the code or by a generated TSID
 * - access: access token -> basic id
 * - refresh: refresh token -> basic id
 *
 * Access/refresh grants are written in a single transaction so either all
 * records exist or none do. Every record carries {@code expiresAt} and is
 * reaped by the TTL index; reads also skip records that are past
 * {@code expiresAt} but not yet reaped.
 *
 * The store keeps no mutable state and is safe to share between threads.
 */
public class MongoTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(MongoTokenStore.class);

    static final int CONNECT_TIMEOUT_SECONDS = 10;

    private final MongoClient mongoClient;
    private final boolean ownsClient;
    private final String databaseName;
    private final TokenCollections collections;
    private final TokenStoreSettings settings;
    private final GrantCodec codec;
    private final Clock clock;

    /**
     * Create a store on a client owned by the caller. Collections and expiry
     * indexes are ensured before this returns.
     *
     * @throws TokenStoreException if the collections or indexes cannot be set up
     */
    public MongoTokenStore(MongoClient mongoClient, String databaseName,
                           TokenCollections collections, TokenStoreSettings settings) {
        this(mongoClient, false, databaseName, collections, settings, new GrantCodec(), Clock.systemUTC());
    }

    MongoTokenStore(MongoClient mongoClient, boolean ownsClient, String databaseName,
                    TokenCollections collections, TokenStoreSettings settings,
                    GrantCodec codec, Clock clock) {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("Database name must not be blank");
        }
        this.mongoClient = mongoClient;
        this.ownsClient = ownsClient;
        this.databaseName = databaseName;
        this.collections = collections;
        this.settings = settings;
        this.codec = codec;
        this.clock = clock;

        new ExpiryIndexInitializer(database(), settings.expireAfter())
            .initialize(collections.recordCollections());
    }

    /**
     * Connect to {@code url} and create a store that owns the resulting client.
     * The client is closed by {@link #close()}.
     */
    public static MongoTokenStore connect(String url, String databaseName,
                                          TokenCollections collections, TokenStoreSettings settings) {
        MongoClientSettings clientSettings = MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(url))
            .applyToSocketSettings(socket -> socket.connectTimeout(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            .build();
        MongoClient client = MongoClients.create(clientSettings);
        try {
            return new MongoTokenStore(client, true, databaseName, collections, settings,
                new GrantCodec(), Clock.systemUTC());
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    // ========================================
    // Writes
    // ========================================

    @Override
    public void create(TokenGrant grant) {
        if (grant == null) {
            throw new IllegalArgumentException("Grant must not be null");
        }
        if (grant.hasCode()) {
            createCodeGrant(grant);
        } else {
            createAccessGrant(grant);
        }
    }

    private void createCodeGrant(TokenGrant grant) {
        Object id = settings.keyEncoding().encode(grant.code());
        Instant expiresAt = grant.codeExpiresAt();
        BasicRecord record = new BasicRecord(id, codec.encode(grant), expiresAt);

        try {
            collection(collections.basic()).insertOne(record.toDocument());
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to store authorization code grant", e);
        }
        LOG.debugf("Stored authorization code grant for client %s, expires at %s", grant.clientId(), record.expiresAt());
    }

    private void createAccessGrant(TokenGrant grant) {
        KeyEncoding encoding = settings.keyEncoding();
        Object accessKey = encoding.encode(grant.access());
        Object refreshKey = grant.hasRefresh() ? encoding.encode(grant.refresh()) : null;
        GrantExpiry expiry = GrantExpiry.of(grant);
        byte[] payload = codec.encode(grant);

        String basicId = TsidGenerator.generate();

        BasicRecord basic = new BasicRecord(basicId, payload, expiry.basic());
        IndexRecord access = new IndexRecord(accessKey, basicId, expiry.access());
        IndexRecord refresh = refreshKey != null ? new IndexRecord(refreshKey, basicId, expiry.refresh()) : null;

        ClientSession session;
        try {
            session = mongoClient.startSession();
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to start session for access grant", e);
        }

        try (session) {
            session.startTransaction(transactionOptions());
            try {
                collection(collections.basic()).insertOne(session, basic.toDocument());
                collection(collections.access()).insertOne(session, access.toDocument());
                if (refresh != null) {
                    collection(collections.refresh()).insertOne(session, refresh.toDocument());
                }
            } catch (RuntimeException e) {
                abort(session, e);
                if (e instanceof MongoException) {
                    throw new TokenStoreException("Failed to store access grant, transaction aborted", e);
                }
                throw e;
            }

            try {
                session.commitTransaction();
            } catch (MongoException e) {
                throw new TokenStoreException("Failed to commit access grant", e);
            }
        }
        LOG.debugf("Stored access grant %s for client %s (refresh=%s)", basicId, grant.clientId(), refresh != null);
    }

    private void abort(ClientSession session, RuntimeException cause) {
        if (!session.hasActiveTransaction()) {
            return;
        }
        try {
            session.abortTransaction();
        } catch (MongoException abortError) {
            LOG.warnf("Failed to abort token transaction: %s", abortError.getMessage());
            cause.addSuppressed(abortError);
        }
    }

    private TransactionOptions transactionOptions() {
        return TransactionOptions.builder()
            .readConcern(ReadConcern.SNAPSHOT)
            .writeConcern(WriteConcern.MAJORITY)
            .maxCommitTime(settings.operationTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public void removeByCode(String code) {
        remove(collections.basic(), code);
    }

    @Override
    public void removeByAccess(String access) {
        remove(collections.access(), access);
    }

    @Override
    public void removeByRefresh(String refresh) {
        remove(collections.refresh(), refresh);
    }

    private void remove(String collectionName, String token) {
        Object key = settings.keyEncoding().encode(token);
        DeleteResult result;
        try {
            result = collection(collectionName).deleteOne(Filters.eq(RecordFields.ID, key));
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to remove token from " + collectionName, e);
        }
        LOG.debugf("Removed %d record(s) from %s", result.getDeletedCount(), collectionName);
    }

    // ========================================
    // Reads
    // ========================================

    @Override
    public Optional<TokenGrant> getByCode(String code) {
        Object key = settings.keyEncoding().encode(code);
        return findLive(collections.basic(), key).map(this::decode);
    }

    @Override
    public Optional<TokenGrant> getByAccess(String access) {
        return getByIndex(collections.access(), access);
    }

    @Override
    public Optional<TokenGrant> getByRefresh(String refresh) {
        return getByIndex(collections.refresh(), refresh);
    }

    private Optional<TokenGrant> getByIndex(String indexCollection, String token) {
        Object key = settings.keyEncoding().encode(token);
        Optional<IndexRecord> index = findLive(indexCollection, key).map(IndexRecord::fromDocument);
        if (index.isEmpty()) {
            return Optional.empty();
        }

        String basicId = index.get().basicId();
        if (basicId == null) {
            LOG.warnf("Index record in %s has no basic id", indexCollection);
            return Optional.empty();
        }

        // The basic record may have expired or been removed under a live index
        Optional<TokenGrant> grant = findLive(collections.basic(), basicId).map(this::decode);
        if (grant.isEmpty()) {
            LOG.debugf("Basic record %s referenced from %s is gone", basicId, indexCollection);
        }
        return grant;
    }

    private Optional<Document> findLive(String collectionName, Object key) {
        Bson filter = Filters.and(
            Filters.eq(RecordFields.ID, key),
            Filters.gt(RecordFields.EXPIRES_AT, Date.from(now())));
        try {
            return Optional.ofNullable(collection(collectionName)
                .find(filter)
                .maxTime(settings.operationTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .first());
        } catch (MongoException e) {
            throw new TokenStoreException("Failed to read from " + collectionName, e);
        }
    }

    private TokenGrant decode(Document doc) {
        return codec.decode(BasicRecord.fromDocument(doc).payload());
    }

    // ========================================
    // Lifecycle
    // ========================================

    @Override
    public void close() {
        if (ownsClient) {
            LOG.debug("Closing token store MongoDB client");
            mongoClient.close();
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private MongoDatabase database() {
        return mongoClient.getDatabase(databaseName);
    }

    private MongoCollection<Document> collection(String name) {
        return database().getCollection(name);
    }
}
