package com.hotride.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP for identity-provider key fetches. Every call is bounded by the configured timeouts.
 */
@Configuration
public class HttpClientConfig {

    private final AuthProperties properties;

    public HttpClientConfig(AuthProperties properties) {
        this.properties = properties;
    }

    @Bean("providerRestTemplate")
    public RestTemplate providerRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getHttp().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getHttp().getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
