package com.hotride.auth.service;

import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AuthProvider;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.repository.AccountRepository;
import com.hotride.auth.service.verification.VerificationCodeService;
import com.hotride.auth.util.IdentifierFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service for handling password reset operations.
 *
 * <p>This service orchestrates the three-step password reset flow:
 * 1. Request reset → Email a reset code
 * 2. Verify code → Issue short-lived reset token
 * 3. Reset password → Replace the BCrypt hash
 * </p>
 *
 * <p>Security features:
 * - No account enumeration (step 1 always looks successful)
 * - Reset codes live in their own slot and never disturb a pending email verification
 * - Reset tokens are bound to the password hash they were issued against, so each works once
 * </p>
 */
@Service
public class PasswordResetService {

    private static final Logger logger = LoggerFactory.getLogger(PasswordResetService.class);

    private final AccountRepository accountRepository;
    private final VerificationCodeService verificationCodeService;
    private final JwtService jwtService;
    private final PasswordService passwordService;

    public PasswordResetService(AccountRepository accountRepository,
                                VerificationCodeService verificationCodeService,
                                JwtService jwtService,
                                PasswordService passwordService) {
        this.accountRepository = accountRepository;
        this.verificationCodeService = verificationCodeService;
        this.jwtService = jwtService;
        this.passwordService = passwordService;
    }

    /**
     * Step 1: send a reset code if, and only if, the email belongs to an active, verified password account.
     * Returns normally whether or not a code went out.
     */
    public void requestPasswordReset(String email) {
        String normalizedEmail = IdentifierFormat.requireEmail(email);
        Optional<Account> accountOpt = findResettable(normalizedEmail);
        if (accountOpt.isEmpty()) {
            logger.info("Password reset requested for an email with no resettable account");
            return;
        }

        try {
            verificationCodeService.issue(CodeChannel.EMAIL, CodePurpose.PASSWORD_RESET, normalizedEmail);
            logger.info("Password reset code sent: accountId={}", accountOpt.get().getId());
        } catch (AuthException e) {
            // Answer as for an unknown email either way.
            if (e.getErrorCode() == AuthErrorCode.RATE_LIMITED) {
                logger.info("Password reset code for account {} still in cooldown", accountOpt.get().getId());
            } else {
                logger.error("Failed to send password reset code for account {}: {}",
                        accountOpt.get().getId(), e.getErrorCode(), e);
            }
        }
    }

    /**
     * Step 2: exchange a valid reset code for a reset token.
     */
    public String verifyResetCode(String email, String code) {
        Account account = findResettable(IdentifierFormat.normalizeEmail(email))
                .orElseThrow(() -> new AuthException(AuthErrorCode.NO_ACTIVE_CODE));

        verificationCodeService.redeem(CodeChannel.EMAIL, CodePurpose.PASSWORD_RESET, account.getEmail(), code);

        logger.info("Password reset code verified: accountId={}", account.getId());
        return jwtService.generatePasswordResetToken(account);
    }

    /**
     * Step 3: set the new password.
     */
    public void resetPassword(String resetToken, String newPassword) {
        IdentifierFormat.requirePassword(newPassword);
        JwtService.PasswordResetClaims claims = jwtService.parsePasswordResetToken(resetToken);

        Account account = accountRepository.findById(claims.accountId())
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_RESET_TOKEN));
        if (!JwtService.passwordFingerprint(account.getPasswordHash()).equals(claims.passwordFingerprint())) {
            logger.warn("Stale or replayed reset token for account {}", account.getId());
            throw new AuthException(AuthErrorCode.INVALID_RESET_TOKEN);
        }

        account.setPasswordHash(passwordService.encryptPassword(newPassword));
        accountRepository.save(account);
        verificationCodeService.discard(CodeChannel.EMAIL, CodePurpose.PASSWORD_RESET, account.getEmail());
        logger.info("Password reset completed: accountId={}", account.getId());
    }

    private Optional<Account> findResettable(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return accountRepository.findByEmail(email)
                .filter(account -> account.getAuthProvider() == AuthProvider.EMAIL)
                .filter(account -> Boolean.TRUE.equals(account.getEmailVerified()))
                .filter(account -> !account.isDisabled());
    }
}
