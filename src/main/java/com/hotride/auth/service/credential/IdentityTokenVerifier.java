package com.hotride.auth.service.credential;

import com.hotride.auth.exception.AuthException;
import com.hotride.auth.model.AuthProvider;

/**
 * Checks a provider-issued identity token: signature against the provider's published keys, issuer,
 * audience and expiry.
 */
public interface IdentityTokenVerifier {

    AuthProvider provider();

    /**
     * @throws AuthException {@code INVALID_TOKEN} if any check fails, {@code PROVIDER_UNAVAILABLE} if the
     *                       provider's keys could not be fetched
     */
    ProviderClaims verify(String token);
}
