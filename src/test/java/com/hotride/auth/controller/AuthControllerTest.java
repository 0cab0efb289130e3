package com.hotride.auth.controller;

import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.exception.GlobalExceptionHandler;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.service.AccountLifecycleService;
import com.hotride.auth.service.AuthResult;
import com.hotride.auth.service.PasswordResetService;
import com.hotride.auth.service.credential.AppleUserData;
import com.hotride.auth.service.verification.IssuedCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link AuthController}
 *
 * Test Coverage:
 * - Registration, email verification and resend
 * - Password, Google and Apple sign-in
 * - The three password reset steps
 * - Error bodies rendered by {@link GlobalExceptionHandler}
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthController Tests")
class AuthControllerTest {

    @Mock
    private AccountLifecycleService accountLifecycleService;

    @Mock
    private PasswordResetService passwordResetService;

    private MockMvc mockMvc;
    private Account account;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(accountLifecycleService, passwordResetService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        account = Account.forPasswordRegistration("Jane Doe", "jane@example.com", "$2a$04$hash");
        account.setEmailVerified(true);
    }

    @Nested
    @DisplayName("POST /auth/register")
    class Register {

        @Test
        @DisplayName("Should return 201 and send a verification code")
        void register_valid_returnsCreated() throws Exception {
            when(accountLifecycleService.register("Jane Doe", "jane@example.com", "password123")).thenReturn(account);

            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fullName\":\"Jane Doe\",\"email\":\"jane@example.com\",\"password\":\"password123\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.message").value("Account created. Please check your email for a verification code."));
        }

        @Test
        @DisplayName("Should return 400 when fields are missing")
        void register_missingFields_returnsValidationError() throws Exception {
            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fullName\":\"Jane Doe\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.retryable").value(false));

            verifyNoInteractions(accountLifecycleService);
        }

        @Test
        @DisplayName("Should return 409 for an existing account")
        void register_duplicate_returnsConflict() throws Exception {
            when(accountLifecycleService.register(anyString(), anyString(), anyString()))
                    .thenThrow(new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT));

            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fullName\":\"Jane Doe\",\"email\":\"jane@example.com\",\"password\":\"password123\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("DUPLICATE_ACCOUNT"));
        }

        @Test
        @DisplayName("Should return 400 for a malformed body")
        void register_malformedJson_returnsBadRequest() throws Exception {
            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request body"));
        }
    }

    @Nested
    @DisplayName("Email verification")
    class EmailVerification {

        @Test
        void verifyEmail_valid_returnsSession() throws Exception {
            when(accountLifecycleService.verifyEmail("jane@example.com", "123456"))
                    .thenReturn(new AuthResult("session-token", 86_400L, account));

            mockMvc.perform(post("/auth/verify-email")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"jane@example.com\",\"code\":\"123456\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").value("session-token"))
                    .andExpect(jsonPath("$.tokenType").value("Bearer"))
                    .andExpect(jsonPath("$.expiresIn").value(86400))
                    .andExpect(jsonPath("$.user.email").value("jane@example.com"))
                    .andExpect(jsonPath("$.user.authProvider").value("email"))
                    .andExpect(jsonPath("$.user.emailVerified").value(true))
                    .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
        }

        @Test
        void verifyEmail_expiredCode_returnsBadRequest() throws Exception {
            when(accountLifecycleService.verifyEmail("jane@example.com", "123456"))
                    .thenThrow(new AuthException(AuthErrorCode.CODE_EXPIRED));

            mockMvc.perform(post("/auth/verify-email")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"jane@example.com\",\"code\":\"123456\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("CODE_EXPIRED"))
                    .andExpect(jsonPath("$.message").value("This code has expired. Please request a new one."));
        }

        @Test
        void resendEmailCode_returnsExpiry() throws Exception {
            Instant expiresAt = Instant.parse("2026-03-01T10:10:00Z");
            when(accountLifecycleService.resendEmailCode("jane@example.com"))
                    .thenReturn(new IssuedCode(CodeChannel.EMAIL, CodePurpose.VERIFY, "jane@example.com", expiresAt));

            mockMvc.perform(post("/auth/resend-email-code")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"jane@example.com\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.expiresAt").value("2026-03-01T10:10:00Z"));
        }

        @Test
        void resendEmailCode_rateLimited_returns429() throws Exception {
            when(accountLifecycleService.resendEmailCode("jane@example.com"))
                    .thenThrow(new AuthException(AuthErrorCode.RATE_LIMITED));

            mockMvc.perform(post("/auth/resend-email-code")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"jane@example.com\"}"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.error").value("RATE_LIMITED"));
        }
    }

    @Nested
    @DisplayName("Sign-in")
    class SignIn {

        @Test
        void login_valid_returnsSession() throws Exception {
            when(accountLifecycleService.login("jane@example.com", "password123"))
                    .thenReturn(new AuthResult("session-token", 86_400L, account));

            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"jane@example.com\",\"password\":\"password123\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").value("session-token"));
        }

        @Test
        void login_invalidCredentials_returns401() throws Exception {
            when(accountLifecycleService.login("jane@example.com", "wrong-password"))
                    .thenThrow(AuthException.invalidCredentials());

            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"jane@example.com\",\"password\":\"wrong-password\"}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"))
                    .andExpect(jsonPath("$.message").value("Invalid email/phone or password."));
        }

        @Test
        void login_unverified_returns403() throws Exception {
            when(accountLifecycleService.login(anyString(), anyString()))
                    .thenThrow(new AuthException(AuthErrorCode.ACCOUNT_NOT_VERIFIED));

            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identifier\":\"jane@example.com\",\"password\":\"password123\"}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("ACCOUNT_NOT_VERIFIED"));
        }

        @Test
        void google_providerDown_returns503Retryable() throws Exception {
            when(accountLifecycleService.loginWithGoogle("google-token"))
                    .thenThrow(AuthException.providerUnavailable("Google sign-in is temporarily unavailable", null));

            mockMvc.perform(post("/auth/google")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"idToken\":\"google-token\"}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("PROVIDER_UNAVAILABLE"))
                    .andExpect(jsonPath("$.retryable").value(true));
        }

        @Test
        void apple_passesNonceAndUserData() throws Exception {
            when(accountLifecycleService.loginWithApple(eq("apple-token"), eq("raw-nonce"), any(AppleUserData.class)))
                    .thenReturn(new AuthResult("session-token", 86_400L, account));

            mockMvc.perform(post("/auth/apple")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identityToken\":\"apple-token\",\"nonce\":\"raw-nonce\","
                                    + "\"userData\":{\"email\":\"jane@icloud.com\",\"fullName\":\"Jane Doe\"}}"))
                    .andExpect(status().isOk());

            verify(accountLifecycleService).loginWithApple("apple-token", "raw-nonce",
                    new AppleUserData("jane@icloud.com", "Jane Doe"));
        }

        @Test
        void apple_withoutUserData_passesNull() throws Exception {
            when(accountLifecycleService.loginWithApple("apple-token", "raw-nonce", null))
                    .thenReturn(new AuthResult("session-token", 86_400L, account));

            mockMvc.perform(post("/auth/apple")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"identityToken\":\"apple-token\",\"nonce\":\"raw-nonce\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").value("session-token"));
        }
    }

    @Nested
    @DisplayName("Password reset")
    class PasswordReset {

        @Test
        void forgotPassword_alwaysReturnsGenericMessage() throws Exception {
            mockMvc.perform(post("/auth/password/forgot")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"nobody@example.com\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("If an account exists for this email, a reset code has been sent."));

            verify(passwordResetService).requestPasswordReset("nobody@example.com");
        }

        @Test
        void verifyCode_returnsResetToken() throws Exception {
            when(passwordResetService.verifyResetCode("jane@example.com", "654321")).thenReturn("reset-token");

            mockMvc.perform(post("/auth/password/verify-code")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"jane@example.com\",\"code\":\"654321\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.resetToken").value("reset-token"));
        }

        @Test
        void reset_invalidToken_returns401() throws Exception {
            doThrow(new AuthException(AuthErrorCode.INVALID_RESET_TOKEN))
                    .when(passwordResetService).resetPassword("stale-token", "newpassword1");

            mockMvc.perform(post("/auth/password/reset")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resetToken\":\"stale-token\",\"newPassword\":\"newpassword1\"}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_RESET_TOKEN"));
        }
    }
}
