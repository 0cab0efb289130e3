package com.hotride.auth.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void handleAuthException_usesCodeStatusAndMessage() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleAuthException(new AuthException(AuthErrorCode.NONCE_MISMATCH));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody())
                .containsEntry("error", "NONCE_MISMATCH")
                .containsEntry("message", AuthErrorCode.NONCE_MISMATCH.getDefaultMessage())
                .containsEntry("retryable", false);
    }

    @Test
    void handleAuthException_providerUnavailable_isRetryable() {
        ResponseEntity<Map<String, Object>> response = handler.handleAuthException(
                AuthException.providerUnavailable("Apple sign-in is temporarily unavailable", new RuntimeException()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody())
                .containsEntry("message", "Apple sign-in is temporarily unavailable")
                .containsEntry("retryable", true);
    }

    @Test
    void handleDatabaseException_hidesDetails() {
        ResponseEntity<Map<String, Object>> response = handler.handleDatabaseException(
                new RepositoryException("Failed to save account", DynamoDbException.builder().message("boom").build()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody())
                .containsEntry("error", "DATABASE_ERROR")
                .containsEntry("retryable", true);
        assertThat(response.getBody().get("message").toString()).doesNotContain("boom");
    }

    @Test
    void handleGenericException_returnsInternalError() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(new IllegalStateException("bug"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "INTERNAL_ERROR");
    }

    @Test
    void everyErrorCode_hasMessageAndClientOrServiceStatus() {
        for (AuthErrorCode code : AuthErrorCode.values()) {
            assertThat(code.getDefaultMessage()).isNotBlank();
            assertThat(code.getHttpStatus().is4xxClientError() || code == AuthErrorCode.PROVIDER_UNAVAILABLE)
                    .as(code.name())
                    .isTrue();
        }
    }
}
