package com.hotride.auth.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;

@Configuration
@ConditionalOnProperty(name = "hotride.sms.provider", havingValue = "sns")
public class SnsConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    @Bean
    public SnsClient snsClient(AuthProperties properties) {
        return SnsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(c -> c.apiCallTimeout(properties.getHttp().getReadTimeout()))
                .build();
    }
}
