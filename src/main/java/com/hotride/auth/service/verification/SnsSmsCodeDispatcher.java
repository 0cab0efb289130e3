package com.hotride.auth.service.verification;

import com.hotride.auth.exception.CodeDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

import java.util.Map;

/**
 * Sends codes as transactional SMS through AWS SNS.
 * <p>
 * Note: Bean is created by {@link com.hotride.auth.config.SmsDispatchConfig}
 */
public class SnsSmsCodeDispatcher extends SmsCodeDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SnsSmsCodeDispatcher.class);

    private final SnsClient snsClient;

    public SnsSmsCodeDispatcher(SnsClient snsClient, String allowlist) {
        super(allowlist);
        this.snsClient = snsClient;
    }

    @Override
    protected void send(String phoneNumber, String message) {
        try {
            PublishRequest request = PublishRequest.builder()
                .phoneNumber(phoneNumber)
                .message(message)
                .messageAttributes(Map.of("AWS.SNS.SMS.SMSType",
                    MessageAttributeValue.builder()
                        .stringValue("Transactional")
                        .dataType("String")
                        .build()))
                .build();

            PublishResponse response = snsClient.publish(request);
            logger.info("SMS sent with messageId: {}", response.messageId());
        } catch (SdkException e) {
            logger.error("Failed to send SMS through SNS: {}", e.getMessage(), e);
            throw new CodeDispatchException("Failed to send verification SMS", e);
        }
    }
}
