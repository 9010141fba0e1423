package tech.tokenstore.grant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * A single OAuth 2.0 issuance: either an authorization code, or an
 * access token with an optional refresh token.
 *
 * <p>The store treats this as an opaque value. It only reads the token
 * strings and the creation/lifetime pairs to derive record keys and expiry
 * instants; everything else travels in the encoded payload.
 */
public record TokenGrant(
    String clientId,
    String userId,
    String redirectUri,
    String scope,

    String code,
    Instant codeCreatedAt,
    Duration codeExpiresIn,

    String access,
    Instant accessCreatedAt,
    Duration accessExpiresIn,

    String refresh,
    Instant refreshCreatedAt,
    Duration refreshExpiresIn
) {

    @JsonIgnore
    public boolean hasCode() {
        return code != null && !code.isEmpty();
    }

    @JsonIgnore
    public boolean hasRefresh() {
        return refresh != null && !refresh.isEmpty();
    }

    @JsonIgnore
    public Instant codeExpiresAt() {
        return expiry(codeCreatedAt, codeExpiresIn);
    }

    @JsonIgnore
    public Instant accessExpiresAt() {
        return expiry(accessCreatedAt, accessExpiresIn);
    }

    @JsonIgnore
    public Instant refreshExpiresAt() {
        return expiry(refreshCreatedAt, refreshExpiresIn);
    }

    // A missing lifetime means the token expires at its creation instant
    private static Instant expiry(Instant createdAt, Duration expiresIn) {
        if (createdAt == null) {
            throw new IllegalArgumentException("Token creation time is not set");
        }
        return expiresIn == null ? createdAt : createdAt.plus(expiresIn);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String clientId;
        private String userId;
        private String redirectUri;
        private String scope;
        private String code;
        private Instant codeCreatedAt;
        private Duration codeExpiresIn;
        private String access;
        private Instant accessCreatedAt;
        private Duration accessExpiresIn;
        private String refresh;
        private Instant refreshCreatedAt;
        private Duration refreshExpiresIn;

        public Builder clientId(String clientId) { this.clientId = clientId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder redirectUri(String redirectUri) { this.redirectUri = redirectUri; return this; }
        public Builder scope(String scope) { this.scope = scope; return this; }

        public Builder code(String code, Instant createdAt, Duration expiresIn) {
            this.code = code;
            this.codeCreatedAt = createdAt;
            this.codeExpiresIn = expiresIn;
            return this;
        }

        public Builder access(String access, Instant createdAt, Duration expiresIn) {
            this.access = access;
            this.accessCreatedAt = createdAt;
            this.accessExpiresIn = expiresIn;
            return this;
        }

        public Builder refresh(String refresh, Instant createdAt, Duration expiresIn) {
            this.refresh = refresh;
            this.refreshCreatedAt = createdAt;
            this.refreshExpiresIn = expiresIn;
            return this;
        }

        public TokenGrant build() {
            return new TokenGrant(clientId, userId, redirectUri, scope,
                code, codeCreatedAt, codeExpiresIn,
                access, accessCreatedAt, accessExpiresIn,
                refresh, refreshCreatedAt, refreshExpiresIn);
        }
    }
}
