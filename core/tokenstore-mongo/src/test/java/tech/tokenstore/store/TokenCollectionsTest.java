package tech.tokenstore.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TokenCollectionsTest {

    @Test
    @DisplayName("defaults should use the oauth2 collection names")
    void defaults_shouldUseOauth2Names() {
        TokenCollections collections = TokenCollections.defaults();

        assertThat(collections.txn()).isEqualTo("oauth2_txn");
        assertThat(collections.recordCollections())
            .containsExactly("oauth2_basic", "oauth2_access", "oauth2_refresh");
    }

    @Test
    @DisplayName("record collections must be distinct")
    void constructor_shouldReject_whenCollectionsShareName() {
        assertThatThrownBy(() -> new TokenCollections("txn", "basic", "basic", "refresh"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("distinct");
    }

    @Test
    @DisplayName("record collection names must not be blank")
    void constructor_shouldReject_whenNameBlank() {
        assertThatThrownBy(() -> new TokenCollections("txn", "basic", " ", "refresh"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("access");
    }
}
