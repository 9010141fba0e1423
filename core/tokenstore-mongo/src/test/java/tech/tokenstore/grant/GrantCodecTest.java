package tech.tokenstore.grant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GrantCodecTest {

    private final GrantCodec codec = new GrantCodec();

    @Test
    @DisplayName("decode should restore every field of an access/refresh grant")
    void decode_shouldRestoreAllFields_whenAccessGrantEncoded() {
        // Arrange
        Instant created = Instant.parse("2024-03-01T10:15:30.123Z");
        TokenGrant grant = TokenGrant.builder()
            .clientId("1")
            .userId("1_2")
            .redirectUri("http://localhost/")
            .scope("all")
            .access("1_2_1", created, Duration.ofSeconds(5))
            .refresh("1_2_2", created, Duration.ofSeconds(15))
            .build();

        // Act
        TokenGrant decoded = codec.decode(codec.encode(grant));

        // Assert
        assertThat(decoded).isEqualTo(grant);
        assertThat(decoded.hasCode()).isFalse();
        assertThat(decoded.hasRefresh()).isTrue();
    }

    @Test
    @DisplayName("encode should write ISO instants and durations")
    void encode_shouldWriteIsoValues() {
        TokenGrant grant = TokenGrant.builder()
            .userId("u")
            .code("abc123", Instant.parse("2024-03-01T10:00:00Z"), Duration.ofSeconds(5))
            .build();

        String json = new String(codec.encode(grant), StandardCharsets.UTF_8);

        assertThat(json)
            .contains("\"code\":\"abc123\"")
            .contains("2024-03-01T10:00:00Z")
            .contains("PT5S")
            .doesNotContain("hasCode");
    }

    @Test
    @DisplayName("decode should ignore fields it does not know")
    void decode_shouldIgnoreUnknownFields() {
        byte[] payload = "{\"userId\":\"u1\",\"legacyField\":true}".getBytes(StandardCharsets.UTF_8);

        TokenGrant decoded = codec.decode(payload);

        assertThat(decoded.userId()).isEqualTo("u1");
        assertThat(decoded.code()).isNull();
    }

    @Test
    @DisplayName("decode should fail with codec exception when payload is not JSON")
    void decode_shouldThrow_whenPayloadCorrupt() {
        byte[] payload = {0x01, 0x02, 0x03};

        assertThatThrownBy(() -> codec.decode(payload))
            .isInstanceOf(GrantCodecException.class)
            .hasMessageContaining("Failed to decode");
    }

    @Test
    @DisplayName("decode should fail with codec exception when payload is missing")
    void decode_shouldThrow_whenPayloadMissing() {
        assertThatThrownBy(() -> codec.decode(null))
            .isInstanceOf(GrantCodecException.class)
            .hasMessageContaining("empty");
    }
}
