package com.hotride.auth.controller;

import com.hotride.auth.config.JwtAuthenticationFilter;
import com.hotride.auth.exception.AuthErrorCode;
import com.hotride.auth.exception.AuthException;
import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

/**
 * Base for controllers behind bearer authentication.
 */
public abstract class BaseController {

    /**
     * Extract the authenticated account id set by {@link JwtAuthenticationFilter}.
     */
    protected UUID extractAccountId(HttpServletRequest request) {
        Object accountId = request.getAttribute(JwtAuthenticationFilter.ACCOUNT_ID_ATTRIBUTE);
        if (accountId == null || accountId.toString().isBlank()) {
            throw new AuthException(AuthErrorCode.SESSION_EXPIRED);
        }
        return UUID.fromString(accountId.toString());
    }
}
