package tech.tokenstore.store;

import org.bson.types.ObjectId;

/**
 * How token values are stored as {@code _id} keys.
 */
public enum KeyEncoding {

    /**
     * Token values are stored as-is.
     */
    STRING {
        @Override
        Object encodeNonEmpty(String token) {
            return token;
        }
    },

    /**
     * Token values must be 24 character hex strings and are stored as ObjectIds.
     */
    OBJECT_ID {
        @Override
        Object encodeNonEmpty(String token) {
            if (!ObjectId.isValid(token)) {
                throw new InvalidTokenKeyException("Token value is not a valid ObjectId hex string: " + token);
            }
            return new ObjectId(token);
        }
    };

    /**
     * Convert a token value into the key used for {@code _id} lookups.
     *
     * @throws InvalidTokenKeyException if the value is empty or cannot be encoded
     */
    public Object encode(String token) {
        if (token == null || token.isEmpty()) {
            throw new InvalidTokenKeyException("Token value must not be empty");
        }
        return encodeNonEmpty(token);
    }

    abstract Object encodeNonEmpty(String token);
}
