package tech.tokenstore.store;

import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KeyEncodingTest {

    @Test
    @DisplayName("STRING should keep token values unchanged")
    void string_shouldReturnTokenAsIs() {
        assertThat(KeyEncoding.STRING.encode("1_1_1")).isEqualTo("1_1_1");
    }

    @Test
    @DisplayName("OBJECT_ID should convert hex tokens to ObjectIds")
    void objectId_shouldConvertHexToken() {
        String hex = new ObjectId().toHexString();

        assertThat(KeyEncoding.OBJECT_ID.encode(hex)).isEqualTo(new ObjectId(hex));
    }

    @Test
    @DisplayName("OBJECT_ID should reject tokens that are not hex ObjectIds")
    void objectId_shouldReject_whenTokenNotHex() {
        assertThatThrownBy(() -> KeyEncoding.OBJECT_ID.encode("1_1_1"))
            .isInstanceOf(InvalidTokenKeyException.class)
            .hasMessageContaining("1_1_1");
    }

    @Test
    @DisplayName("every encoding should reject empty tokens")
    void encode_shouldReject_whenTokenEmpty() {
        for (KeyEncoding encoding : KeyEncoding.values()) {
            assertThatThrownBy(() -> encoding.encode(""))
                .isInstanceOf(InvalidTokenKeyException.class);
            assertThatThrownBy(() -> encoding.encode(null))
                .isInstanceOf(InvalidTokenKeyException.class);
        }
    }
}
