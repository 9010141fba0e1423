package tech.tokenstore.store;

/**
 * A token value cannot be turned into a record key under the configured
 * {@link KeyEncoding}. Raised before any database call is made.
 */
public class InvalidTokenKeyException extends IllegalArgumentException {

    public InvalidTokenKeyException(String message) {
        super(message);
    }
}
