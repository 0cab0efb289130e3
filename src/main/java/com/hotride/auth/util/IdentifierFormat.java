package com.hotride.auth.util;

import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shape checks and canonical forms for login identifiers.
 * <p>
 * Emails are trimmed and lower-cased. Phones keep an optional leading {@code +} followed by digits,
 * with spaces, dashes and parentheses removed.
 */
public final class IdentifierFormat {

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MIN_PHONE_DIGITS = 10;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE_DECORATION = Pattern.compile("[+\\-\\s()]");

    public enum Kind { EMAIL, PHONE }

    private IdentifierFormat() {
    }

    /**
     * Classify a free-form login identifier. Anything containing {@code @} is an email; otherwise
     * at least ten digits (after stripping phone decoration) make it a phone.
     *
     * @throws AuthException with {@link AuthErrorCode#INVALID_IDENTIFIER} for anything else
     */
    public static Kind sniff(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_IDENTIFIER);
        }
        if (identifier.contains("@")) {
            return Kind.EMAIL;
        }
        if (isPhone(identifier)) {
            return Kind.PHONE;
        }
        throw new AuthException(AuthErrorCode.INVALID_IDENTIFIER);
    }

    public static boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value.trim()).matches();
    }

    public static boolean isPhone(String value) {
        if (value == null) {
            return false;
        }
        String digits = PHONE_DECORATION.matcher(value).replaceAll("");
        return digits.length() >= MIN_PHONE_DIGITS && digits.chars().allMatch(Character::isDigit);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String trimmed = phone.trim();
        String digits = PHONE_DECORATION.matcher(trimmed).replaceAll("");
        return trimmed.startsWith("+") ? "+" + digits : digits;
    }

    /** Validated, canonical email or {@code VALIDATION_FAILED}. */
    public static String requireEmail(String email) {
        if (!isEmail(email)) {
            throw AuthException.validation("Please enter a valid email address");
        }
        return normalizeEmail(email);
    }

    /** Validated, canonical phone or {@code VALIDATION_FAILED}. */
    public static String requirePhone(String phone) {
        String digits = phone == null ? "" : PHONE_DECORATION.matcher(phone).replaceAll("");
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw AuthException.validation("Please enter a valid phone number");
        }
        if (digits.length() < MIN_PHONE_DIGITS) {
            throw AuthException.validation("Phone number must be at least " + MIN_PHONE_DIGITS + " digits");
        }
        return normalizePhone(phone);
    }

    public static void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw AuthException.validation("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }
}
