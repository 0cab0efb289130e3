package com.hotride.auth.service.verification;

import com.hotride.auth.exception.CodeDispatchException;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;

import java.time.Duration;

/**
 * Delivers a plaintext code to its target over one channel. Implementations never log the code
 * except for allowlisted test targets.
 */
public interface CodeDispatcher {

    CodeChannel channel();

    /**
     * @throws CodeDispatchException if the mail server or SMS gateway rejected or could not be reached
     */
    void dispatch(String target, String code, CodePurpose purpose, Duration validity);

    static String messageFor(String code, CodePurpose purpose, Duration validity) {
        String action = purpose == CodePurpose.PASSWORD_RESET ? "password reset" : "verification";
        return String.format("Your HotRide %s code is %s. Do not share it with anyone. This code expires in %d minutes.",
                action, code, validity.toMinutes());
    }
}
