package com.hotride.auth.repository;

import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.model.VerificationCode;

import java.util.Optional;

public interface VerificationCodeRepository {

    void save(VerificationCode verificationCode);

    Optional<VerificationCode> find(CodeChannel channel, CodePurpose purpose, String target);

    void delete(CodeChannel channel, CodePurpose purpose, String target);
}
