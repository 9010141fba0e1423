package tech.tokenstore.store;

import tech.tokenstore.grant.TokenGrant;

import java.time.Instant;

/**
 * Expiry instants for the records written for one access/refresh grant.
 *
 * <p>The access index never outlives the refresh token, and the basic record
 * lives as long as the longest-lived index that points at it.
 *
 * @param basic   expiry of the basic record
 * @param access  expiry of the access index record
 * @param refresh expiry of the refresh index record, null without a refresh token
 */
record GrantExpiry(Instant basic, Instant access, Instant refresh) {

    static GrantExpiry of(TokenGrant grant) {
        Instant access = grant.accessExpiresAt();
        if (!grant.hasRefresh()) {
            return new GrantExpiry(access, access, null);
        }
        Instant refresh = grant.refreshExpiresAt();
        if (access.isAfter(refresh)) {
            access = refresh;
        }
        return new GrantExpiry(refresh, access, refresh);
    }
}
