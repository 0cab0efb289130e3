package com.hotride.auth.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * App-side entry point for authentication. Talks to the HotRide auth service and keeps the
 * {@link SessionManager} in step with what the service returns.
 * <p>
 * Every failure is an {@link AuthClientException}; a failing {@link SecureSessionStore} surfaces as
 * {@link AuthErrorKind#UNKNOWN}. A 401 on a call made with the session token clears the session and
 * surfaces as {@link AuthErrorKind#SESSION_EXPIRED}.
 */
public class HotRideAuthClient {

    private static final Logger logger = LoggerFactory.getLogger(HotRideAuthClient.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public HotRideAuthClient(RestTemplate restTemplate, String baseUrl, SessionManager sessionManager) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.sessionManager = sessionManager;
        this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Client with the default 10 second connect and read timeouts.
     */
    public static HotRideAuthClient create(String baseUrl, SecureSessionStore store) {
        RestTemplate restTemplate = new RestTemplateBuilder()
                .setConnectTimeout(DEFAULT_TIMEOUT)
                .setReadTimeout(DEFAULT_TIMEOUT)
                .build();
        return new HotRideAuthClient(restTemplate, baseUrl, new SessionManager(store));
    }

    public SessionManager sessionManager() {
        return sessionManager;
    }

    public Optional<Session> restore() {
        return sessionManager.restore();
    }

    public Optional<Session> currentSession() {
        return sessionManager.currentSession();
    }

    public boolean isAuthenticated() {
        return sessionManager.isAuthenticated();
    }

    public Session login(String identifier, String password) {
        return establish(post("/auth/login", Map.of("identifier", identifier, "password", password), TokenResponse.class));
    }

    public Session loginWithGoogle(String idToken) {
        return establish(post("/auth/google", Map.of("idToken", idToken), TokenResponse.class));
    }

    /**
     * @param email    from the first-consent user data, may be {@code null}
     * @param fullName from the first-consent user data, may be {@code null}
     */
    public Session loginWithApple(String identityToken, String nonce, String email, String fullName) {
        Map<String, Object> body = new HashMap<>();
        body.put("identityToken", identityToken);
        body.put("nonce", nonce);
        if (email != null || fullName != null) {
            Map<String, String> userData = new HashMap<>();
            userData.put("email", email);
            userData.put("fullName", fullName);
            body.put("userData", userData);
        }
        return establish(post("/auth/apple", body, TokenResponse.class));
    }

    public void register(String fullName, String email, String password) {
        post("/auth/register", Map.of("fullName", fullName, "email", email, "password", password), JsonNode.class);
    }

    public Session verifyEmail(String email, String code) {
        return establish(post("/auth/verify-email", Map.of("email", email, "code", code), TokenResponse.class));
    }

    public void resendEmailCode(String email) {
        post("/auth/resend-email-code", Map.of("email", email), JsonNode.class);
    }

    public void sendPhoneCode(String phone) {
        authenticated(HttpMethod.POST, "/users/me/phone/send-code", Map.of("phone", phone), JsonNode.class);
    }

    public UserSnapshot verifyPhone(String phone, String code) {
        UserSnapshot user = authenticated(HttpMethod.POST, "/users/me/phone/verify",
                Map.of("phone", phone, "code", code), UserSnapshot.class);
        updateUser(user);
        return user;
    }

    /**
     * @param phone optional; when given it must be the rider's verified phone
     */
    public UserSnapshot completeProfile(String fullName, String profilePictureRef, String phone) {
        Map<String, String> body = new HashMap<>();
        body.put("fullName", fullName);
        body.put("profilePictureRef", profilePictureRef);
        body.put("phone", phone);
        UserSnapshot user = authenticated(HttpMethod.POST, "/users/me/profile", body, UserSnapshot.class);
        updateUser(user);
        return user;
    }

    public UserSnapshot refreshUser() {
        UserSnapshot user = authenticated(HttpMethod.GET, "/users/me", null, UserSnapshot.class);
        updateUser(user);
        return user;
    }

    /**
     * The in-memory session is dropped even when the stored slots cannot be deleted.
     */
    public void logout() {
        try {
            sessionManager.clear();
        } catch (SessionStoreException e) {
            throw storageFailure(e);
        }
        logger.info("Signed out");
    }

    private Session establish(TokenResponse response) {
        if (response == null || response.accessToken() == null || response.user() == null) {
            throw new AuthClientException(AuthErrorKind.UNKNOWN, "Sign-in response was incomplete");
        }
        try {
            return sessionManager.establish(response.accessToken(), response.user());
        } catch (SessionStoreException e) {
            throw storageFailure(e);
        }
    }

    private void updateUser(UserSnapshot user) {
        try {
            sessionManager.updateUser(user);
        } catch (SessionStoreException e) {
            throw storageFailure(e);
        }
    }

    private static AuthClientException storageFailure(SessionStoreException e) {
        logger.error("Session storage failed: {}", e.getMessage());
        return new AuthClientException(AuthErrorKind.UNKNOWN, "Could not save your session. Please try again.", e);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        return exchange(HttpMethod.POST, path, body, null, responseType);
    }

    private <T> T authenticated(HttpMethod method, String path, Object body, Class<T> responseType) {
        Session session = sessionManager.currentSession()
                .orElseThrow(() -> new AuthClientException(AuthErrorKind.SESSION_EXPIRED,
                        "Session expired. Please log in again."));
        try {
            return exchange(method, path, body, session.token(), responseType);
        } catch (AuthClientException e) {
            if (e.getKind() == AuthErrorKind.SESSION_EXPIRED) {
                try {
                    sessionManager.clear();
                } catch (SessionStoreException clearFailure) {
                    logger.error("Failed to clear expired session: {}", clearFailure.getMessage());
                    e.addSuppressed(clearFailure);
                }
            }
            throw e;
        }
    }

    private <T> T exchange(HttpMethod method, String path, Object body, String bearerToken, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (bearerToken != null) {
            headers.setBearerAuth(bearerToken);
        }
        try {
            return restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, headers), responseType).getBody();
        } catch (HttpStatusCodeException e) {
            throw translate(e, bearerToken != null);
        } catch (ResourceAccessException e) {
            logger.warn("Auth service unreachable: {}", e.getMessage());
            throw new AuthClientException(AuthErrorKind.NETWORK_ERROR,
                    "No internet connection. Please check your network.", e);
        } catch (RestClientException e) {
            throw new AuthClientException(AuthErrorKind.UNKNOWN, "Something went wrong. Please try again.", e);
        }
    }

    private AuthClientException translate(HttpStatusCodeException e, boolean authenticatedCall) {
        if (authenticatedCall && e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
            return new AuthClientException(AuthErrorKind.SESSION_EXPIRED, "Session expired. Please log in again.", e);
        }
        AuthErrorKind kind = AuthErrorKind.UNKNOWN;
        String message = "Something went wrong. Please try again.";
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error != null) {
                kind = AuthErrorKind.fromWire(error.path("error").asText(null));
                if (error.hasNonNull("message")) {
                    message = error.get("message").asText();
                }
            }
        } catch (IOException parseFailure) {
            logger.warn("Unreadable error body for HTTP {}", e.getStatusCode().value());
        }
        return new AuthClientException(kind, message, e);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(String accessToken, String tokenType, long expiresIn, UserSnapshot user) {
    }
}
