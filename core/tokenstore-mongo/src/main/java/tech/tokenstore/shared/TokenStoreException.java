package tech.tokenstore.shared;

/**
 * Storage failure reported by the token store: connection problems, write or
 * read errors, aborted transactions and payload encoding failures.
 *
 * <p>Not-found is never reported through this exception.
 */
public class TokenStoreException extends RuntimeException {

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
