package com.hotride.auth.service.verification;

import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;

import java.time.Instant;

/**
 * Receipt for a dispatched code. The plaintext code only ever travels to the dispatcher.
 */
public record IssuedCode(CodeChannel channel, CodePurpose purpose, String target, Instant expiresAt) {
}
