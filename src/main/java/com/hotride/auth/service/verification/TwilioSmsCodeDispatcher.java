package com.hotride.auth.service.verification;

import com.hotride.auth.exception.CodeDispatchException;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends codes through the Twilio Messaging API. Codes are generated and stored locally, so only
 * message delivery is delegated to Twilio.
 * <p>
 * Note: Bean is created by {@link com.hotride.auth.config.SmsDispatchConfig}
 */
public class TwilioSmsCodeDispatcher extends SmsCodeDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(TwilioSmsCodeDispatcher.class);

    private final PhoneNumber fromNumber;

    public TwilioSmsCodeDispatcher(String fromNumber, String allowlist) {
        super(allowlist);
        this.fromNumber = new PhoneNumber(fromNumber);
    }

    @Override
    protected void send(String phoneNumber, String message) {
        try {
            Message sent = Message.creator(new PhoneNumber(phoneNumber), fromNumber, message).create();
            logger.info("SMS sent through Twilio with SID: {}", sent.getSid());
        } catch (TwilioException e) {
            logger.error("Failed to send SMS through Twilio: {}", e.getMessage(), e);
            throw new CodeDispatchException("Failed to send verification SMS", e);
        }
    }
}
