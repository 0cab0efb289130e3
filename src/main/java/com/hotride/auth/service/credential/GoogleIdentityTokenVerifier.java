package com.hotride.auth.service.credential;

import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.model.AuthProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Set;

@Component
public class GoogleIdentityTokenVerifier extends JwksIdentityTokenVerifier {

    static final Set<String> ISSUERS = Set.of("accounts.google.com", "https://accounts.google.com");

    public GoogleIdentityTokenVerifier(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                       AuthProperties properties, Clock clock) {
        super(restTemplate, properties.getGoogle(), ISSUERS, clock);
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.GOOGLE;
    }

    @Override
    protected String providerName() {
        return "Google";
    }
}
