package com.hotride.auth.service;

import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.exception.DuplicateIdentifierException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AccountState;
import com.hotride.auth.model.AuthProvider;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.repository.AccountRepository;
import com.hotride.auth.service.credential.AppleCredential;
import com.hotride.auth.service.credential.AppleUserData;
import com.hotride.auth.service.credential.CredentialVerifier;
import com.hotride.auth.service.credential.GoogleCredential;
import com.hotride.auth.service.credential.PasswordCredential;
import com.hotride.auth.service.verification.IssuedCode;
import com.hotride.auth.service.verification.VerificationCodeService;
import com.hotride.auth.util.IdentifierFormat;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves a rider through registration, verification, sign-in and profile completion.
 * <p>
 * Each operation either applies its whole transition or leaves the account as it was.
 */
@Service
public class AccountLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(AccountLifecycleService.class);

    private final AccountRepository accountRepository;
    private final CredentialVerifier credentialVerifier;
    private final VerificationCodeService verificationCodeService;
    private final PasswordService passwordService;
    private final JwtService jwtService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AccountLifecycleService(AccountRepository accountRepository,
                                   CredentialVerifier credentialVerifier,
                                   VerificationCodeService verificationCodeService,
                                   PasswordService passwordService,
                                   JwtService jwtService,
                                   MeterRegistry meterRegistry,
                                   Clock clock) {
        this.accountRepository = accountRepository;
        this.credentialVerifier = credentialVerifier;
        this.verificationCodeService = verificationCodeService;
        this.passwordService = passwordService;
        this.jwtService = jwtService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Create an unverified email account and send its verification code. Re-registering an email whose
     * account never got verified replaces the name and password and sends a fresh code.
     */
    public Account register(String fullName, String email, String password) {
        String name = requireName(fullName);
        String normalizedEmail = IdentifierFormat.requireEmail(email);
        IdentifierFormat.requirePassword(password);

        Optional<Account> existing = accountRepository.findByEmail(normalizedEmail);
        if (existing.isPresent()
                && (existing.get().getAuthProvider() != AuthProvider.EMAIL
                    || Boolean.TRUE.equals(existing.get().getEmailVerified()))) {
            logger.info("Registration rejected, email already belongs to account {}", existing.get().getId());
            throw new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT);
        }

        Account account;
        if (existing.isPresent()) {
            account = existing.get();
            account.setFullName(name);
            account.setPasswordHash(passwordService.encryptPassword(password));
            accountRepository.save(account);
            logger.info("Re-registered unverified account {}", account.getId());
        } else {
            account = Account.forPasswordRegistration(name, normalizedEmail, passwordService.encryptPassword(password));
            try {
                accountRepository.create(account);
            } catch (DuplicateIdentifierException e) {
                throw new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT);
            }
            logger.info("Registered account {}", account.getId());
        }
        meterRegistry.counter("account_registration_total").increment();

        try {
            verificationCodeService.issue(CodeChannel.EMAIL, CodePurpose.VERIFY, normalizedEmail);
        } catch (AuthException e) {
            // Registration stands; the rider can use resend.
            if (e.getErrorCode() == AuthErrorCode.RATE_LIMITED) {
                logger.info("Verification code for account {} still in cooldown", account.getId());
            } else {
                logger.error("Failed to send verification code for account {}: {}", account.getId(), e.getErrorCode());
            }
        }
        return account;
    }

    public AuthResult verifyEmail(String email, String code) {
        Account account = findEmailAccount(email)
                .orElseThrow(() -> new AuthException(AuthErrorCode.NO_ACTIVE_CODE));

        requireActive(account);
        verificationCodeService.redeem(CodeChannel.EMAIL, CodePurpose.VERIFY, account.getEmail(), code);

        account.setEmailVerified(true);
        accountRepository.save(account);
        logger.info("Verified email for account {}", account.getId());
        return issueSession(account, "verify_email");
    }

    public IssuedCode resendEmailCode(String email) {
        Account account = findEmailAccount(email)
                .orElseThrow(() -> new AuthException(AuthErrorCode.ACCOUNT_NOT_FOUND));
        if (Boolean.TRUE.equals(account.getEmailVerified())) {
            throw new AuthException(AuthErrorCode.ALREADY_VERIFIED);
        }
        return verificationCodeService.issue(CodeChannel.EMAIL, CodePurpose.VERIFY, account.getEmail());
    }

    public AuthResult login(String identifier, String password) {
        Account account = credentialVerifier.verify(new PasswordCredential(identifier, password)).account();
        if (account.currentState() == AccountState.REGISTERED_UNVERIFIED) {
            logger.info("Login blocked for unverified account {}", account.getId());
            throw new AuthException(AuthErrorCode.ACCOUNT_NOT_VERIFIED);
        }
        return issueSession(account, "password");
    }

    public AuthResult loginWithGoogle(String idToken) {
        Account account = credentialVerifier.verify(new GoogleCredential(idToken)).account();
        return issueSession(account, "google");
    }

    public AuthResult loginWithApple(String identityToken, String nonce, AppleUserData userData) {
        Account account = credentialVerifier.verify(new AppleCredential(identityToken, nonce, userData)).account();
        return issueSession(account, "apple");
    }

    public IssuedCode sendPhoneCode(UUID accountId, String phone) {
        Account account = requireAccount(accountId);
        String normalizedPhone = IdentifierFormat.requirePhone(phone);
        if (Boolean.TRUE.equals(account.getPhoneVerified()) && normalizedPhone.equals(account.getPhone())) {
            throw new AuthException(AuthErrorCode.ALREADY_VERIFIED, "This phone number is already verified.");
        }
        requirePhoneAvailable(account, normalizedPhone);
        return verificationCodeService.issue(CodeChannel.PHONE, CodePurpose.VERIFY, normalizedPhone);
    }

    /**
     * Confirm phone ownership. The account gains a verified phone; no session is issued.
     */
    public Account verifyPhone(UUID accountId, String phone, String code) {
        Account account = requireAccount(accountId);
        String normalizedPhone = IdentifierFormat.requirePhone(phone);

        requirePhoneAvailable(account, normalizedPhone);
        verificationCodeService.redeem(CodeChannel.PHONE, CodePurpose.VERIFY, normalizedPhone, code);

        String previousPhone = verifiedPhone(account);
        String phoneBefore = account.getPhone();
        account.setPhone(normalizedPhone);
        account.setPhoneVerified(true);
        try {
            accountRepository.saveWithPhoneClaim(account, previousPhone);
        } catch (DuplicateIdentifierException e) {
            account.setPhone(phoneBefore);
            account.setPhoneVerified(previousPhone != null);
            logger.info("Phone verification for account {} lost to another account", account.getId());
            throw new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT,
                    "This phone number is already linked to another account.");
        }
        logger.info("Verified phone for account {}", account.getId());
        return account;
    }

    public Account completeProfile(UUID accountId, ProfileSetup setup) {
        Account account = requireAccount(accountId);
        if (!account.currentState().isAtLeast(AccountState.EMAIL_VERIFIED)) {
            throw new AuthException(AuthErrorCode.ACCOUNT_NOT_VERIFIED);
        }
        String name = requireName(setup.fullName());

        if (setup.phone() != null && !setup.phone().isBlank()) {
            String normalizedPhone = IdentifierFormat.normalizePhone(setup.phone());
            if (!Boolean.TRUE.equals(account.getPhoneVerified()) || !normalizedPhone.equals(account.getPhone())) {
                throw new AuthException(AuthErrorCode.PHONE_NOT_VERIFIED);
            }
        }

        account.setFullName(name);
        if (setup.profilePictureRef() != null) {
            account.setProfilePictureRef(setup.profilePictureRef());
        }
        if (account.getProfileCompletedAt() == null) {
            account.setProfileCompletedAt(clock.instant());
        }
        accountRepository.save(account);
        logger.info("Completed profile for account {}", account.getId());
        return account;
    }

    public Account updateProfile(UUID accountId, ProfileUpdate update) {
        Account account = requireAccount(accountId);
        String name = update.fullName() != null ? requireName(update.fullName()) : null;
        String phone = update.phone() != null ? IdentifierFormat.requirePhone(update.phone()) : null;

        if (name != null) {
            account.setFullName(name);
        }
        if (update.profilePictureRef() != null) {
            account.setProfilePictureRef(update.profilePictureRef());
        }
        if (phone != null && !Objects.equals(phone, account.getPhone())) {
            String releasedPhone = verifiedPhone(account);
            account.setPhone(phone);
            account.setPhoneVerified(false);
            logger.info("Phone changed for account {}, verification cleared", account.getId());
            if (releasedPhone != null) {
                return accountRepository.saveWithPhoneClaim(account, releasedPhone);
            }
        }
        accountRepository.save(account);
        return account;
    }

    public Account currentAccount(UUID accountId) {
        return requireAccount(accountId);
    }

    private AuthResult issueSession(Account account, String method) {
        String token = jwtService.generateToken(account);
        meterRegistry.counter("auth_session_issued_total", "method", method).increment();
        logger.info("Issued session for account {} via {}", account.getId(), method);
        return new AuthResult(token, jwtService.getSessionExpirationSeconds(), account);
    }

    private Optional<Account> findEmailAccount(String email) {
        if (!IdentifierFormat.isEmail(email)) {
            return Optional.empty();
        }
        return accountRepository.findByEmail(IdentifierFormat.normalizeEmail(email))
                .filter(account -> account.getAuthProvider() == AuthProvider.EMAIL);
    }

    private Account requireAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.ACCOUNT_NOT_FOUND));
    }

    private void requirePhoneAvailable(Account account, String phone) {
        accountRepository.findByVerifiedPhone(phone)
                .filter(owner -> !owner.getId().equals(account.getId()))
                .ifPresent(owner -> {
                    throw new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT,
                            "This phone number is already linked to another account.");
                });
    }

    private static String verifiedPhone(Account account) {
        return Boolean.TRUE.equals(account.getPhoneVerified()) ? account.getPhone() : null;
    }

    private static Account requireActive(Account account) {
        if (account.isDisabled()) {
            throw new AuthException(AuthErrorCode.ACCOUNT_DISABLED);
        }
        return account;
    }

    private static String requireName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw AuthException.validation("Full name is required");
        }
        return fullName.trim();
    }
}
