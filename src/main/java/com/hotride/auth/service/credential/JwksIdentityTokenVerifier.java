package com.hotride.auth.service.credential;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.exception.AuthException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.security.Key;
import java.time.Clock;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Verifies RS256 identity tokens against a provider's JSON Web Key Set.
 * <p>
 * Keys are fetched over HTTP and cached for {@code key-cache-ttl}. A token signed with a key id that is
 * not in the cached set triggers one refetch, which covers provider key rotation.
 */
public abstract class JwksIdentityTokenVerifier implements IdentityTokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(JwksIdentityTokenVerifier.class);
    private static final String JWKS_CACHE_KEY = "jwks";

    private final RestTemplate restTemplate;
    private final AuthProperties.Provider settings;
    private final Set<String> acceptedIssuers;
    private final Clock clock;
    private final Cache<String, Map<String, Key>> keyCache;

    protected JwksIdentityTokenVerifier(RestTemplate restTemplate, AuthProperties.Provider settings,
                                        Set<String> acceptedIssuers, Clock clock) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.acceptedIssuers = acceptedIssuers;
        this.clock = clock;
        this.keyCache = Caffeine.newBuilder()
                .expireAfterWrite(settings.getKeyCacheTtl())
                .maximumSize(1)
                .build();
    }

    @Override
    public ProviderClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.invalidToken("Identity token is required");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .keyLocator(new ProviderKeyLocator())
                    .requireAudience(settings.getClientId())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ProviderKeysUnavailableException e) {
            logger.error("Could not fetch {} signing keys: {}", provider(), e.getMessage());
            throw AuthException.providerUnavailable(providerName() + " sign-in is temporarily unavailable", e);
        } catch (JwtException | IllegalArgumentException e) {
            logger.warn("Rejected {} identity token: {}", provider(), e.getMessage());
            throw AuthException.invalidToken("Invalid " + providerName() + " token");
        }

        if (!acceptedIssuers.contains(claims.getIssuer())) {
            logger.warn("Rejected {} identity token with issuer {}", provider(), claims.getIssuer());
            throw AuthException.invalidToken("Invalid " + providerName() + " token issuer");
        }
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw AuthException.invalidToken("Invalid " + providerName() + " token subject");
        }
        return toProviderClaims(claims);
    }

    protected abstract String providerName();

    protected ProviderClaims toProviderClaims(Claims claims) {
        return new ProviderClaims(
                claims.getSubject(),
                claims.get("email", String.class),
                booleanClaim(claims.get("email_verified")),
                claims.get("name", String.class),
                claims.get("picture", String.class),
                claims.get("nonce", String.class));
    }

    // Apple sends some booleans as the strings "true" and "false".
    protected static boolean booleanClaim(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private Key findKey(String keyId) {
        Key key = currentKeys(false).get(keyId);
        if (key == null) {
            logger.info("Unknown {} key id {}, refreshing key set", provider(), keyId);
            key = currentKeys(true).get(keyId);
        }
        return key;
    }

    private Map<String, Key> currentKeys(boolean refresh) {
        if (refresh) {
            keyCache.invalidate(JWKS_CACHE_KEY);
        }
        return keyCache.get(JWKS_CACHE_KEY, ignored -> fetchKeys());
    }

    private Map<String, Key> fetchKeys() {
        String json;
        try {
            json = restTemplate.getForObject(settings.getJwksUri(), String.class);
        } catch (RestClientException e) {
            throw new ProviderKeysUnavailableException(e.getMessage(), e);
        }
        if (json == null) {
            throw new ProviderKeysUnavailableException("Empty key set response", null);
        }
        JwkSet jwkSet;
        try {
            jwkSet = Jwks.setParser().build().parse(json);
        } catch (JwtException | IllegalArgumentException e) {
            throw new ProviderKeysUnavailableException("Unreadable key set: " + e.getMessage(), e);
        }
        Map<String, Key> keys = new HashMap<>();
        for (Jwk<?> jwk : jwkSet.getKeys()) {
            if (jwk.getId() != null) {
                keys.put(jwk.getId(), jwk.toKey());
            }
        }
        logger.info("Loaded {} signing keys for {}", keys.size(), provider());
        return keys;
    }

    private final class ProviderKeyLocator extends LocatorAdapter<Key> {

        @Override
        protected Key locate(JwsHeader header) {
            String keyId = header.getKeyId();
            if (keyId == null) {
                throw new JwtException("Token header has no key id");
            }
            Key key = findKey(keyId);
            if (key == null) {
                throw new JwtException("No " + provider() + " signing key with id " + keyId);
            }
            return key;
        }
    }

    static final class ProviderKeysUnavailableException extends RuntimeException {

        ProviderKeysUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
