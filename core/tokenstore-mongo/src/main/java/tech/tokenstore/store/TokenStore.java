package tech.tokenstore.store;

import tech.tokenstore.grant.TokenGrant;

import java.util.Optional;

/**
 * Storage and lookup of OAuth 2.0 grants.
 *
 * Lookups that find nothing return an empty Optional. Malformed token values
 * raise {@link InvalidTokenKeyException}; storage failures raise
 * {@link tech.tokenstore.shared.TokenStoreException}. Removing a token that
 * does not exist is not an error.
 */
public interface TokenStore extends AutoCloseable {

    // Write operations
    void create(TokenGrant grant);
    void removeByCode(String code);
    void removeByAccess(String access);
    void removeByRefresh(String refresh);

    // Read operations
    Optional<TokenGrant> getByCode(String code);
    Optional<TokenGrant> getByAccess(String access);
    Optional<TokenGrant> getByRefresh(String refresh);

    @Override
    void close();
}
