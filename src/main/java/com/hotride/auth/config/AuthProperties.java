package com.hotride.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables for credential exchange, session tokens and verification codes.
 * Bound from the {@code hotride.auth.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "hotride.auth")
public class AuthProperties {

    private final Jwt jwt = new Jwt();
    private final Verification verification = new Verification();
    private final Provider google = new Provider(
            "https://www.googleapis.com/oauth2/v3/certs");
    private final Provider apple = new Provider(
            "https://appleid.apple.com/auth/keys");
    private final Http http = new Http();

    private int bcryptStrength = 12;

    private String mailFrom = "HotRide <no-reply@hotride.app>";

    public Jwt getJwt() {
        return jwt;
    }

    public Verification getVerification() {
        return verification;
    }

    public Provider getGoogle() {
        return google;
    }

    public Provider getApple() {
        return apple;
    }

    public Http getHttp() {
        return http;
    }

    public int getBcryptStrength() {
        return bcryptStrength;
    }

    public void setBcryptStrength(int bcryptStrength) {
        this.bcryptStrength = bcryptStrength;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public void setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
    }

    public static class Jwt {

        /**
         * HMAC secret for session tokens. Must be at least 32 characters; deployed environments
         * override the local default through {@code HOTRIDE_AUTH_JWT_SECRET}.
         */
        private String secret = "default_secret_for_local_development_only_12345";

        @DurationUnit(ChronoUnit.HOURS)
        private Duration sessionTtl = Duration.ofHours(24);

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration passwordResetTtl = Duration.ofMinutes(15);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }

        public Duration getPasswordResetTtl() {
            return passwordResetTtl;
        }

        public void setPasswordResetTtl(Duration passwordResetTtl) {
            this.passwordResetTtl = passwordResetTtl;
        }
    }

    public static class Verification {

        private int codeLength = 6;

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration codeTtl = Duration.ofMinutes(10);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration resendCooldown = Duration.ofSeconds(30);

        private int maxFailedAttempts = 5;

        public int getCodeLength() {
            return codeLength;
        }

        public void setCodeLength(int codeLength) {
            this.codeLength = codeLength;
        }

        public Duration getCodeTtl() {
            return codeTtl;
        }

        public void setCodeTtl(Duration codeTtl) {
            this.codeTtl = codeTtl;
        }

        public Duration getResendCooldown() {
            return resendCooldown;
        }

        public void setResendCooldown(Duration resendCooldown) {
            this.resendCooldown = resendCooldown;
        }

        public int getMaxFailedAttempts() {
            return maxFailedAttempts;
        }

        public void setMaxFailedAttempts(int maxFailedAttempts) {
            this.maxFailedAttempts = maxFailedAttempts;
        }
    }

    public static class Provider {

        private String clientId = "";
        private String jwksUri;

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration keyCacheTtl = Duration.ofMinutes(60);

        public Provider() {
        }

        Provider(String jwksUri) {
            this.jwksUri = jwksUri;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getJwksUri() {
            return jwksUri;
        }

        public void setJwksUri(String jwksUri) {
            this.jwksUri = jwksUri;
        }

        public Duration getKeyCacheTtl() {
            return keyCacheTtl;
        }

        public void setKeyCacheTtl(Duration keyCacheTtl) {
            this.keyCacheTtl = keyCacheTtl;
        }
    }

    public static class Http {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(5);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration readTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
