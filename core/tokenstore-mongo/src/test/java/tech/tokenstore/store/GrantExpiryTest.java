package tech.tokenstore.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tokenstore.grant.TokenGrant;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GrantExpiryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("access-only grant should expire basic and access records together")
    void of_shouldUseAccessExpiry_whenNoRefreshToken() {
        TokenGrant grant = TokenGrant.builder()
            .access("a", T0, Duration.ofSeconds(5))
            .build();

        GrantExpiry expiry = GrantExpiry.of(grant);

        assertThat(expiry.basic()).isEqualTo(T0.plusSeconds(5));
        assertThat(expiry.access()).isEqualTo(T0.plusSeconds(5));
        assertThat(expiry.refresh()).isNull();
    }

    @Test
    @DisplayName("basic record should live as long as the refresh token")
    void of_shouldKeepBasicUntilRefreshExpiry_whenRefreshOutlivesAccess() {
        TokenGrant grant = TokenGrant.builder()
            .access("a", T0, Duration.ofSeconds(5))
            .refresh("r", T0, Duration.ofSeconds(15))
            .build();

        GrantExpiry expiry = GrantExpiry.of(grant);

        assertThat(expiry.access()).isEqualTo(T0.plusSeconds(5));
        assertThat(expiry.refresh()).isEqualTo(T0.plusSeconds(15));
        assertThat(expiry.basic()).isEqualTo(T0.plusSeconds(15));
    }

    @Test
    @DisplayName("access index should not outlive the refresh token")
    void of_shouldClampAccessToRefresh_whenAccessOutlivesRefresh() {
        TokenGrant grant = TokenGrant.builder()
            .access("a", T0, Duration.ofHours(2))
            .refresh("r", T0, Duration.ofHours(1))
            .build();

        GrantExpiry expiry = GrantExpiry.of(grant);

        assertThat(expiry.access()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(expiry.refresh()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(expiry.basic()).isEqualTo(T0.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("comparison should use full instants, not the seconds-of-minute field")
    void of_shouldCompareFullInstants_whenSecondsFieldIsMisleading() {
        // access expires 10:00:50, refresh expires 10:01:10 - access has the larger seconds field
        TokenGrant grant = TokenGrant.builder()
            .access("a", T0, Duration.ofSeconds(50))
            .refresh("r", T0, Duration.ofSeconds(70))
            .build();

        GrantExpiry expiry = GrantExpiry.of(grant);

        assertThat(expiry.access()).isEqualTo(T0.plusSeconds(50));
        assertThat(expiry.basic()).isEqualTo(T0.plusSeconds(70));
    }
}
