package com.hotride.auth.config;

import com.hotride.auth.service.verification.CodeDispatcher;
import com.hotride.auth.service.verification.SnsSmsCodeDispatcher;
import com.hotride.auth.service.verification.TwilioSmsCodeDispatcher;
import com.twilio.Twilio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * Selects the SMS gateway for phone codes from {@code hotride.sms.provider}.
 * <p>
 * Supported providers:
 * - "sns": AWS SNS transactional SMS
 * - "twilio": Twilio Messaging API (default)
 */
@Configuration
public class SmsDispatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(SmsDispatchConfig.class);

    @Bean
    @ConditionalOnProperty(name = "hotride.sms.provider", havingValue = "sns")
    public CodeDispatcher snsSmsCodeDispatcher(SnsClient snsClient,
                                               @Value("${hotride.sms.allowlist:}") String allowlist) {
        logger.info("Configuring AWS SNS SMS dispatcher");
        return new SnsSmsCodeDispatcher(snsClient, allowlist);
    }

    @Bean
    @ConditionalOnProperty(name = "hotride.sms.provider", havingValue = "twilio", matchIfMissing = true)
    public CodeDispatcher twilioSmsCodeDispatcher(
            @Value("${twilio.account-sid:}") String accountSid,
            @Value("${twilio.auth-token:}") String authToken,
            @Value("${twilio.from-number:}") String fromNumber,
            @Value("${hotride.sms.allowlist:}") String allowlist) {
        logger.info("Configuring Twilio SMS dispatcher");
        if (accountSid.isEmpty() || authToken.isEmpty()) {
            logger.warn("Twilio credentials are not configured; only allowlisted numbers will receive codes");
        } else {
            Twilio.init(accountSid, authToken);
        }
        return new TwilioSmsCodeDispatcher(fromNumber, allowlist);
    }
}
