package com.hotride.auth.service.verification;

import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared SMS behaviour: numbers on the {@code hotride.sms.allowlist} get their code in the log
 * instead of a real message.
 */
public abstract class SmsCodeDispatcher implements CodeDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SmsCodeDispatcher.class);

    private final List<String> allowlist;

    protected SmsCodeDispatcher(String allowlistString) {
        this.allowlist = allowlistString == null || allowlistString.isBlank() ?
            List.of() :
            Arrays.stream(allowlistString.split(","))
                .map(String::trim)
                .collect(Collectors.toList());

        logger.info("SMS dispatcher {} initialized with allowlist: {}", getClass().getSimpleName(),
                   allowlist.isEmpty() ? "empty (production mode)" : allowlist.size() + " numbers");
    }

    @Override
    public CodeChannel channel() {
        return CodeChannel.PHONE;
    }

    @Override
    public void dispatch(String target, String code, CodePurpose purpose, Duration validity) {
        if (allowlist.contains(target.trim())) {
            logger.info("[SMS Bypass] {} code for {} is {}", purpose, target, code);
            return;
        }
        send(target, CodeDispatcher.messageFor(code, purpose, validity));
    }

    protected abstract void send(String phoneNumber, String message);
}
