package tech.tokenstore.health;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import tech.tokenstore.config.TokenStoreConfig;

/**
 * Health check for the token store.
 *
 * Reports DOWN if the token database does not answer a ping.
 */
@ApplicationScoped
@Readiness
public class TokenStoreHealthCheck implements HealthCheck {

    static final String NAME = "TokenStore";

    @Inject
    MongoClient mongoClient;

    @Inject
    TokenStoreConfig config;

    @Override
    public HealthCheckResponse call() {
        try {
            mongoClient.getDatabase(config.database()).runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            return HealthCheckResponse.builder()
                    .name(NAME)
                    .down()
                    .withData("database", config.database())
                    .withData("error", e.getMessage())
                    .build();
        }

        return HealthCheckResponse.builder()
                .name(NAME)
                .up()
                .withData("database", config.database())
                .withData("basicCollection", config.collections().basic())
                .withData("accessCollection", config.collections().access())
                .withData("refreshCollection", config.collections().refresh())
                .withData("keyEncoding", config.keyEncoding().name())
                .build();
    }
}
