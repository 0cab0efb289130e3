package com.hotride.auth.service.verification;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import com.hotride.auth.exception.CodeDispatchException;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.model.VerificationCode;
import com.hotride.auth.repository.VerificationCodeRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues and redeems one-time numeric codes for email and phone ownership checks.
 * <p>
 * This implementation:
 * - Generates random codes from {@link SecureRandom} (leading zeros allowed)
 * - Stores only a salted SHA-256 of the code, keyed by channel, purpose and target
 * - Keeps at most one live code per key; a new issue replaces the old one
 * - Enforces expiry, a resend cooldown and a cap on failed attempts
 * <p>
 * Issue and redeem for the same key run under a per-key lock. Locks for different keys never contend.
 */
@Service
public class VerificationCodeService {

    private static final Logger logger = LoggerFactory.getLogger(VerificationCodeService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final VerificationCodeRepository verificationCodeRepository;
    private final Map<CodeChannel, CodeDispatcher> dispatchers = new EnumMap<>(CodeChannel.class);
    private final AuthProperties.Verification settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public VerificationCodeService(VerificationCodeRepository verificationCodeRepository,
                                   List<CodeDispatcher> codeDispatchers,
                                   AuthProperties properties,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.verificationCodeRepository = verificationCodeRepository;
        for (CodeDispatcher dispatcher : codeDispatchers) {
            if (dispatchers.putIfAbsent(dispatcher.channel(), dispatcher) != null) {
                throw new IllegalStateException("More than one code dispatcher for channel " + dispatcher.channel());
            }
        }
        this.settings = properties.getVerification();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Generate a fresh code for the target, replacing any earlier one, and hand it to the channel's
     * dispatcher.
     *
     * @throws AuthException {@code RATE_LIMITED} inside the resend cooldown, {@code PROVIDER_UNAVAILABLE}
     *                       if the dispatcher failed (the new code stays stored)
     */
    public IssuedCode issue(CodeChannel channel, CodePurpose purpose, String target) {
        CodeDispatcher dispatcher = dispatchers.get(channel);
        if (dispatcher == null) {
            throw new IllegalStateException("No code dispatcher configured for channel " + channel);
        }
        String key = VerificationCode.keyFor(channel, purpose, target);
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            Instant now = clock.instant();
            Optional<VerificationCode> previous = verificationCodeRepository.find(channel, purpose, target);
            if (previous.isPresent() && withinCooldown(previous.get(), now)) {
                meterRegistry.counter("verification_code_issue_total", "channel", channel.name(), "status", "rate_limited").increment();
                throw new AuthException(AuthErrorCode.RATE_LIMITED);
            }

            String code = generateCode();
            Duration validity = settings.getCodeTtl();
            VerificationCode verificationCode = new VerificationCode(channel, purpose, target,
                    hash(key, code), now, now.plus(validity));
            verificationCodeRepository.save(verificationCode);

            try {
                dispatcher.dispatch(target, code, purpose, validity);
            } catch (CodeDispatchException e) {
                meterRegistry.counter("verification_code_issue_total", "channel", channel.name(), "status", "dispatch_failed").increment();
                throw AuthException.providerUnavailable("We could not send your code. Please try again.", e);
            }

            verificationCode.setDispatched(true);
            verificationCodeRepository.save(verificationCode);
            meterRegistry.counter("verification_code_issue_total", "channel", channel.name(), "status", "sent").increment();
            logger.info("Issued {} {} code", channel, purpose);
            return new IssuedCode(channel, purpose, target, verificationCode.getExpiresAt());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consume the live code for the target if {@code candidate} matches it.
     *
     * @throws AuthException {@code NO_ACTIVE_CODE}, {@code CODE_EXPIRED} or {@code CODE_MISMATCH}, checked in
     *                       that order
     */
    public void redeem(CodeChannel channel, CodePurpose purpose, String target, String candidate) {
        String key = VerificationCode.keyFor(channel, purpose, target);
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            VerificationCode verificationCode = verificationCodeRepository.find(channel, purpose, target)
                    .filter(VerificationCode::isLive)
                    .orElseThrow(() -> {
                        countRedeem(channel, "no_active_code");
                        return new AuthException(AuthErrorCode.NO_ACTIVE_CODE);
                    });

            if (verificationCode.isExpiredAt(clock.instant())) {
                countRedeem(channel, "expired");
                throw new AuthException(AuthErrorCode.CODE_EXPIRED);
            }

            if (!matches(key, candidate, verificationCode.getHashedCode())) {
                verificationCode.incrementFailedAttempts();
                if (verificationCode.getFailedAttempts() >= settings.getMaxFailedAttempts()) {
                    verificationCode.setConsumed(true);
                    logger.warn("Too many failed attempts for {} {} code, invalidating it", channel, purpose);
                }
                verificationCodeRepository.save(verificationCode);
                countRedeem(channel, "mismatch");
                throw new AuthException(AuthErrorCode.CODE_MISMATCH);
            }

            verificationCode.setConsumed(true);
            verificationCodeRepository.save(verificationCode);
            countRedeem(channel, "success");
            logger.info("Redeemed {} {} code", channel, purpose);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the slot entirely, e.g. once a password reset has been carried out.
     */
    public void discard(CodeChannel channel, CodePurpose purpose, String target) {
        verificationCodeRepository.delete(channel, purpose, target);
    }

    private boolean withinCooldown(VerificationCode previous, Instant now) {
        return previous.isLive()
                && Boolean.TRUE.equals(previous.getDispatched())
                && previous.getIssuedAt() != null
                && now.isBefore(previous.getIssuedAt().plus(settings.getResendCooldown()));
    }

    private void countRedeem(CodeChannel channel, String status) {
        meterRegistry.counter("verification_code_redeem_total", "channel", channel.name(), "status", status).increment();
    }

    String generateCode() {
        int length = settings.getCodeLength();
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(SECURE_RANDOM.nextInt(10));
        }
        return code.toString();
    }

    // Salting with the key means equal codes for different targets never share a hash.
    static String hash(String key, String code) {
        return DigestUtils.sha256Hex(key + ":" + code);
    }

    private static boolean matches(String key, String candidate, String storedHash) {
        if (candidate == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(key, candidate.trim()).getBytes(StandardCharsets.UTF_8),
                storedHash.getBytes(StandardCharsets.UTF_8));
    }
}
