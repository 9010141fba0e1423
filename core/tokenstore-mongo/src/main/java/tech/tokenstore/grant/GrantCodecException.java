package tech.tokenstore.grant;

import tech.tokenstore.shared.TokenStoreException;

/**
 * A grant could not be encoded for storage, or a stored payload could not be
 * decoded back into a grant.
 */
public class GrantCodecException extends TokenStoreException {

    public GrantCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
