package com.hotride.auth.service;

import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AuthProvider;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.service.verification.VerificationCodeService;
import com.hotride.auth.support.InMemoryAccountRepository;
import com.hotride.auth.support.InMemoryVerificationCodeRepository;
import com.hotride.auth.support.MutableClock;
import com.hotride.auth.support.RecordingCodeDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PasswordResetService}.
 * <p>
 * Tests verify:
 * - Requests never reveal whether an account exists
 * - The code, token and password steps chain correctly
 * - Reset tokens expire, are single-use and cannot stand in for session tokens
 */
class PasswordResetServiceTest {

    private static final String EMAIL = "jane@example.com";
    private static final String OLD_PASSWORD = "password123";
    private static final String NEW_PASSWORD = "freshpassword9";

    private InMemoryAccountRepository accountRepository;
    private RecordingCodeDispatcher emailDispatcher;
    private MutableClock clock;
    private PasswordService passwordService;
    private JwtService jwtService;
    private PasswordResetService service;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        properties.setBcryptStrength(4);
        properties.getJwt().setSecret("reset-test-secret-with-more-than-32-characters");

        clock = new MutableClock(Instant.now());
        accountRepository = new InMemoryAccountRepository();
        emailDispatcher = new RecordingCodeDispatcher(CodeChannel.EMAIL);
        passwordService = new PasswordService(properties);
        jwtService = new JwtService(properties, clock);
        jwtService.init();
        VerificationCodeService codeService = new VerificationCodeService(new InMemoryVerificationCodeRepository(),
                List.of(emailDispatcher), properties, clock, new SimpleMeterRegistry());

        service = new PasswordResetService(accountRepository, codeService, jwtService, passwordService);
    }

    private Account passwordAccount(boolean verified) {
        Account account = Account.forPasswordRegistration("Jane Doe", EMAIL, passwordService.encryptPassword(OLD_PASSWORD));
        account.setEmailVerified(verified);
        return accountRepository.create(account);
    }

    private String resetTokenFor(String email) {
        service.requestPasswordReset(email);
        return service.verifyResetCode(email, emailDispatcher.lastCodeFor(EMAIL));
    }

    private static AuthErrorCode errorCodeOf(Throwable e) {
        return ((AuthException) e).getErrorCode();
    }

    // ===== Request =====

    @Test
    void requestPasswordReset_unknownEmail_succeedsSilently() {
        assertThatCode(() -> service.requestPasswordReset("nobody@example.com")).doesNotThrowAnyException();
        assertThat(emailDispatcher.sent()).isEmpty();
    }

    @Test
    void requestPasswordReset_unverifiedAccount_sendsNothing() {
        passwordAccount(false);

        service.requestPasswordReset(EMAIL);

        assertThat(emailDispatcher.sent()).isEmpty();
    }

    @Test
    void requestPasswordReset_providerAccount_sendsNothing() {
        accountRepository.create(Account.forProvider(AuthProvider.APPLE, "apple-sub", EMAIL, "Jane Doe", null));

        service.requestPasswordReset(EMAIL);

        assertThat(emailDispatcher.sent()).isEmpty();
    }

    @Test
    void requestPasswordReset_twiceInsideCooldown_sendsOneCodeAndStaysSilent() {
        // Given
        passwordAccount(true);
        service.requestPasswordReset(EMAIL);

        // When / Then
        assertThatCode(() -> service.requestPasswordReset(EMAIL)).doesNotThrowAnyException();
        assertThat(emailDispatcher.sent()).hasSize(1);
    }

    @Test
    void requestPasswordReset_mailServerDown_answersLikeUnknownEmail() {
        // Given
        passwordAccount(true);
        emailDispatcher.setFailing(true);

        // When / Then
        assertThatCode(() -> service.requestPasswordReset(EMAIL)).doesNotThrowAnyException();
        assertThat(emailDispatcher.sent()).isEmpty();

        emailDispatcher.setFailing(false);
        service.requestPasswordReset(EMAIL);
        assertThat(emailDispatcher.sent()).hasSize(1);
    }

    @Test
    void requestPasswordReset_malformedEmail_throwsValidation() {
        assertThatThrownBy(() -> service.requestPasswordReset("not-an-email"))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.VALIDATION_FAILED));
    }

    // ===== Verify code and reset =====

    @Test
    void fullFlow_replacesPassword() {
        // Given
        Account account = passwordAccount(true);

        // When
        String resetToken = resetTokenFor(EMAIL);
        service.resetPassword(resetToken, NEW_PASSWORD);

        // Then
        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(passwordService.matches(NEW_PASSWORD, stored.getPasswordHash())).isTrue();
        assertThat(passwordService.matches(OLD_PASSWORD, stored.getPasswordHash())).isFalse();
    }

    @Test
    void verifyResetCode_wrongCode_throwsCodeMismatch() {
        // Given
        passwordAccount(true);
        service.requestPasswordReset(EMAIL);
        String wrong = emailDispatcher.lastCodeFor(EMAIL).equals("000000") ? "111111" : "000000";

        // When / Then
        assertThatThrownBy(() -> service.verifyResetCode(EMAIL, wrong))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.CODE_MISMATCH));
    }

    @Test
    void verifyResetCode_unknownEmail_throwsNoActiveCode() {
        assertThatThrownBy(() -> service.verifyResetCode("nobody@example.com", "123456"))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.NO_ACTIVE_CODE));
    }

    @Test
    void resetPassword_tokenUsedTwice_throwsInvalidResetToken() {
        // Given
        passwordAccount(true);
        String resetToken = resetTokenFor(EMAIL);
        service.resetPassword(resetToken, NEW_PASSWORD);

        // When / Then
        assertThatThrownBy(() -> service.resetPassword(resetToken, "anotherpassword"))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.INVALID_RESET_TOKEN));
    }

    @Test
    void resetPassword_afterFifteenMinutes_throwsInvalidResetToken() {
        // Given
        passwordAccount(true);
        String resetToken = resetTokenFor(EMAIL);
        clock.advance(Duration.ofMinutes(16));

        // When / Then
        assertThatThrownBy(() -> service.resetPassword(resetToken, NEW_PASSWORD))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.INVALID_RESET_TOKEN));
    }

    @Test
    void resetPassword_sessionToken_throwsInvalidResetToken() {
        Account account = passwordAccount(true);

        assertThatThrownBy(() -> service.resetPassword(jwtService.generateToken(account), NEW_PASSWORD))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.INVALID_RESET_TOKEN));
    }

    @Test
    void resetPassword_shortPassword_throwsValidationAndKeepsOldPassword() {
        // Given
        Account account = passwordAccount(true);
        String resetToken = resetTokenFor(EMAIL);

        // When / Then
        assertThatThrownBy(() -> service.resetPassword(resetToken, "short"))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(AuthErrorCode.VALIDATION_FAILED));
        assertThat(passwordService.matches(OLD_PASSWORD, account.getPasswordHash())).isTrue();
    }

    @Test
    void requestPasswordReset_afterCompletedReset_canStartAgainImmediately() {
        // Given
        passwordAccount(true);
        service.resetPassword(resetTokenFor(EMAIL), NEW_PASSWORD);

        // When
        service.requestPasswordReset(EMAIL);

        // Then
        assertThat(emailDispatcher.sent()).hasSize(2);
    }
}
