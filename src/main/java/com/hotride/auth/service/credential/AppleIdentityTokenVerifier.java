package com.hotride.auth.service.credential;

import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.model.AuthProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Set;

/**
 * Apple identity tokens carry no name or picture; those arrive once, as {@link AppleUserData}, on the
 * first consent.
 */
@Component
public class AppleIdentityTokenVerifier extends JwksIdentityTokenVerifier {

    static final Set<String> ISSUERS = Set.of("https://appleid.apple.com");

    public AppleIdentityTokenVerifier(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                      AuthProperties properties, Clock clock) {
        super(restTemplate, properties.getApple(), ISSUERS, clock);
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.APPLE;
    }

    @Override
    protected String providerName() {
        return "Apple";
    }
}
