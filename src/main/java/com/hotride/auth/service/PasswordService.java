package com.hotride.auth.service;

import com.hotride.auth.config.AuthProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class PasswordService {

    private final BCryptPasswordEncoder passwordEncoder;

    // Compared against when no account exists so that both login branches pay for one BCrypt check.
    private final String dummyHash;

    public PasswordService(AuthProperties properties) {
        this.passwordEncoder = new BCryptPasswordEncoder(properties.getBcryptStrength());
        this.dummyHash = passwordEncoder.encode("hotride-dummy-password");
    }

    public String encryptPassword(String plainPassword) {
        return passwordEncoder.encode(plainPassword);
    }

    public boolean matches(String plainPassword, String hashedPassword) {
        if (plainPassword == null || hashedPassword == null) {
            return false;
        }
        return passwordEncoder.matches(plainPassword, hashedPassword);
    }

    /**
     * Burn one comparison's worth of time without a real hash. Always false.
     */
    public boolean matchAgainstDummy(String plainPassword) {
        passwordEncoder.matches(plainPassword == null ? "" : plainPassword, dummyHash);
        return false;
    }
}
