package com.hotride.auth.service;

import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.model.Account;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Signs and checks the HS256 tokens this service hands out: 24 hour session tokens and short-lived
 * password reset tokens. The two kinds are never interchangeable.
 */
@Service
public class JwtService {

    static final String TYPE_CLAIM = "type";
    static final String PASSWORD_RESET_TYPE = "password_reset";
    static final String FINGERPRINT_CLAIM = "pwf";

    private final AuthProperties.Jwt settings;
    private final Clock clock;

    private SecretKey key;

    public JwtService(AuthProperties properties, Clock clock) {
        this.settings = properties.getJwt();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        String secret = settings.getSecret();
        // Ensure secret key has proper entropy
        if (secret == null || secret.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was "
                    + (secret == null ? 0 : secret.length()) + ")");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(Account account) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(account.getId().toString())
                .claim("email", account.getEmail())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.getSessionTtl())))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * True for an unexpired, correctly signed session token. Password reset tokens are rejected.
     */
    public boolean isTokenValid(String token) {
        try {
            Claims claims = extractClaims(token);
            return claims.get(TYPE_CLAIM) == null && claims.getSubject() != null;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    public UUID extractAccountId(String token) {
        return UUID.fromString(extractClaims(token).getSubject());
    }

    public long getSessionExpirationSeconds() {
        return settings.getSessionTtl().toSeconds();
    }

    /**
     * Generate a password reset token bound to the account's current password hash, so the token stops
     * working as soon as the password changes.
     */
    public String generatePasswordResetToken(Account account) {
        Instant now = clock.instant();
        Duration ttl = settings.getPasswordResetTtl();
        return Jwts.builder()
                .subject(account.getId().toString())
                .claim(TYPE_CLAIM, PASSWORD_RESET_TYPE)
                .claim(FINGERPRINT_CLAIM, passwordFingerprint(account.getPasswordHash()))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Validate a password reset token and return what it was issued for.
     *
     * @throws AuthException {@code INVALID_RESET_TOKEN} for a bad signature, expiry, or a token of the
     *                       wrong type
     */
    public PasswordResetClaims parsePasswordResetToken(String token) {
        try {
            Claims claims = extractClaims(token);
            if (!PASSWORD_RESET_TYPE.equals(claims.get(TYPE_CLAIM))) {
                throw new AuthException(AuthErrorCode.INVALID_RESET_TOKEN);
            }
            return new PasswordResetClaims(UUID.fromString(claims.getSubject()),
                    claims.get(FINGERPRINT_CLAIM, String.class));
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.INVALID_RESET_TOKEN);
        }
    }

    public static String passwordFingerprint(String passwordHash) {
        return passwordHash == null ? "" : DigestUtils.sha256Hex(passwordHash);
    }

    private Claims extractClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public record PasswordResetClaims(UUID accountId, String passwordFingerprint) {
    }
}
