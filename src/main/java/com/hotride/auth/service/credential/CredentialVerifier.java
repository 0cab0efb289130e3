package com.hotride.auth.service.credential;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.exception.DuplicateIdentifierException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AuthProvider;
import com.hotride.auth.repository.AccountRepository;
import com.hotride.auth.service.PasswordService;
import com.hotride.auth.util.IdentifierFormat;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Optional;

/**
 * Turns a presented credential into a known account.
 * <p>
 * Password credentials only ever resolve existing accounts. Provider credentials resolve by
 * (provider, subject) and create the account on first sign-in. No account is created or modified when
 * verification fails, and password hashes are never touched here.
 */
@Service
public class CredentialVerifier {

    private static final Logger logger = LoggerFactory.getLogger(CredentialVerifier.class);

    // Covers the lifetime of an Apple identity token.
    private static final Duration NONCE_REPLAY_WINDOW = Duration.ofMinutes(10);

    private final AccountRepository accountRepository;
    private final PasswordService passwordService;
    private final GoogleIdentityTokenVerifier googleVerifier;
    private final AppleIdentityTokenVerifier appleVerifier;
    private final Cache<String, Boolean> redeemedNonces = Caffeine.newBuilder()
            .expireAfterWrite(NONCE_REPLAY_WINDOW)
            .maximumSize(100_000)
            .build();

    public CredentialVerifier(AccountRepository accountRepository,
                              PasswordService passwordService,
                              GoogleIdentityTokenVerifier googleVerifier,
                              AppleIdentityTokenVerifier appleVerifier) {
        this.accountRepository = accountRepository;
        this.passwordService = passwordService;
        this.googleVerifier = googleVerifier;
        this.appleVerifier = appleVerifier;
    }

    public AccountIdentity verify(Credential credential) {
        if (credential instanceof PasswordCredential password) {
            return new AccountIdentity(verifyPassword(password), false);
        }
        if (credential instanceof GoogleCredential google) {
            return verifyGoogle(google);
        }
        if (credential instanceof AppleCredential apple) {
            return verifyApple(apple);
        }
        throw new IllegalArgumentException("Unsupported credential " + credential);
    }

    private Account verifyPassword(PasswordCredential credential) {
        IdentifierFormat.Kind kind = IdentifierFormat.sniff(credential.identifier());
        Optional<Account> accountOpt = kind == IdentifierFormat.Kind.EMAIL
                ? accountRepository.findByEmail(IdentifierFormat.normalizeEmail(credential.identifier()))
                : accountRepository.findByVerifiedPhone(IdentifierFormat.normalizePhone(credential.identifier()));

        if (accountOpt.isEmpty() || !accountOpt.get().hasPassword()) {
            passwordService.matchAgainstDummy(credential.password());
            logger.warn("Password sign-in rejected for {} identifier", kind);
            throw AuthException.invalidCredentials();
        }

        Account account = accountOpt.get();
        if (!passwordService.matches(credential.password(), account.getPasswordHash())) {
            logger.warn("Password sign-in rejected for account {}", account.getId());
            throw AuthException.invalidCredentials();
        }
        requireActive(account);
        return account;
    }

    private AccountIdentity verifyGoogle(GoogleCredential credential) {
        ProviderClaims claims = googleVerifier.verify(credential.idToken());
        Optional<Account> existing = accountRepository.findByProviderSubject(AuthProvider.GOOGLE, claims.subject());
        if (existing.isPresent()) {
            return new AccountIdentity(requireActive(existing.get()), false);
        }
        if (claims.email() == null || claims.email().isBlank()) {
            throw AuthException.invalidToken("Email not provided by Google");
        }
        return createProviderAccount(AuthProvider.GOOGLE, claims.subject(), claims.email(),
                claims.name(), claims.picture());
    }

    private AccountIdentity verifyApple(AppleCredential credential) {
        ProviderClaims claims = appleVerifier.verify(credential.identityToken());
        requireNonce(credential.nonce(), claims.nonce());

        Optional<Account> existing = accountRepository.findByProviderSubject(AuthProvider.APPLE, claims.subject());
        if (existing.isPresent()) {
            return new AccountIdentity(requireActive(existing.get()), false);
        }

        AppleUserData userData = credential.userData();
        String email = claims.email() != null ? claims.email() : userData != null ? userData.email() : null;
        if (email == null || email.isBlank()) {
            throw AuthException.invalidToken("Email not provided by Apple. Please try again.");
        }
        return createProviderAccount(AuthProvider.APPLE, claims.subject(), email,
                userData != null ? userData.fullName() : null, null);
    }

    private void requireNonce(String rawNonce, String tokenNonce) {
        if (rawNonce == null || rawNonce.isEmpty() || tokenNonce == null) {
            logger.warn("Apple sign-in rejected: nonce missing");
            throw new AuthException(AuthErrorCode.NONCE_MISMATCH);
        }
        String expected = DigestUtils.sha256Hex(rawNonce);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                tokenNonce.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Apple sign-in rejected: nonce does not match token");
            throw new AuthException(AuthErrorCode.NONCE_MISMATCH);
        }
        if (redeemedNonces.asMap().putIfAbsent(expected, Boolean.TRUE) != null) {
            logger.warn("Apple sign-in rejected: nonce already used");
            throw new AuthException(AuthErrorCode.NONCE_MISMATCH);
        }
    }

    private AccountIdentity createProviderAccount(AuthProvider provider, String subject, String rawEmail,
                                                  String fullName, String pictureRef) {
        String email = IdentifierFormat.normalizeEmail(rawEmail);
        if (accountRepository.findByEmail(email).isPresent()) {
            logger.warn("{} sign-in collided with an existing account email", provider);
            throw new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT);
        }
        Account account = Account.forProvider(provider, subject, email, fullName, pictureRef);
        try {
            accountRepository.create(account);
        } catch (DuplicateIdentifierException e) {
            // A concurrent first sign-in by the same provider user is a success, not a conflict.
            return accountRepository.findByProviderSubject(provider, subject)
                    .map(winner -> new AccountIdentity(winner, false))
                    .orElseThrow(() -> new AuthException(AuthErrorCode.DUPLICATE_ACCOUNT));
        }
        logger.info("Created {} account {} on first sign-in", provider, account.getId());
        return new AccountIdentity(account, true);
    }

    private static Account requireActive(Account account) {
        if (account.isDisabled()) {
            logger.warn("Sign-in rejected for disabled account {}", account.getId());
            throw new AuthException(AuthErrorCode.ACCOUNT_DISABLED);
        }
        return account;
    }
}
