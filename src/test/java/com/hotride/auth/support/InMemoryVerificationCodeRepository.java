package com.hotride.auth.support;

import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.model.VerificationCode;
import com.hotride.auth.repository.VerificationCodeRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVerificationCodeRepository implements VerificationCodeRepository {

    private final Map<String, VerificationCode> codes = new ConcurrentHashMap<>();

    @Override
    public void save(VerificationCode verificationCode) {
        codes.put(verificationCode.getCodeKey(), verificationCode);
    }

    @Override
    public Optional<VerificationCode> find(CodeChannel channel, CodePurpose purpose, String target) {
        return Optional.ofNullable(codes.get(VerificationCode.keyFor(channel, purpose, target)));
    }

    @Override
    public void delete(CodeChannel channel, CodePurpose purpose, String target) {
        codes.remove(VerificationCode.keyFor(channel, purpose, target));
    }
}
