package com.hotride.auth.service;

import com.hotride.auth.config.AuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordServiceTest {

    private PasswordService passwordService;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        properties.setBcryptStrength(4);
        passwordService = new PasswordService(properties);
    }

    @Test
    void encryptPassword_producesSaltedBcryptHash() {
        String first = passwordService.encryptPassword("password123");
        String second = passwordService.encryptPassword("password123");

        assertThat(first).startsWith("$2a$04$").isNotEqualTo(second);
        assertThat(passwordService.matches("password123", first)).isTrue();
        assertThat(passwordService.matches("password123", second)).isTrue();
    }

    @Test
    void matches_wrongPassword_returnsFalse() {
        String hash = passwordService.encryptPassword("password123");

        assertThat(passwordService.matches("password124", hash)).isFalse();
    }

    @Test
    void matches_nulls_returnFalse() {
        assertThat(passwordService.matches(null, "$2a$04$x")).isFalse();
        assertThat(passwordService.matches("password123", null)).isFalse();
    }

    @Test
    void matchAgainstDummy_alwaysFalse() {
        assertThat(passwordService.matchAgainstDummy("hotride-dummy-password")).isFalse();
        assertThat(passwordService.matchAgainstDummy(null)).isFalse();
    }
}
