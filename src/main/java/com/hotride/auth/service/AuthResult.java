package com.hotride.auth.service;

import com.hotride.auth.model.Account;

/**
 * A freshly issued session token and the account it belongs to.
 */
public record AuthResult(String accessToken, long expiresIn, Account account) {
}
