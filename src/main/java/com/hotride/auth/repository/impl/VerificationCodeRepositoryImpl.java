package com.hotride.auth.repository.impl;

import com.hotride.auth.exception.RepositoryException;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.model.VerificationCode;
import com.hotride.auth.repository.VerificationCodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.Optional;

@Repository
public class VerificationCodeRepositoryImpl implements VerificationCodeRepository {

    static final String TABLE_NAME = "VerificationCodes";

    private static final Logger logger = LoggerFactory.getLogger(VerificationCodeRepositoryImpl.class);

    private final DynamoDbTable<VerificationCode> verificationCodeTable;

    public VerificationCodeRepositoryImpl(DynamoDbEnhancedClient enhancedClient) {
        this.verificationCodeTable = enhancedClient.table(TABLE_NAME,
                                                          TableSchema.fromBean(VerificationCode.class));
    }

    @Override
    public void save(VerificationCode verificationCode) {
        try {
            verificationCodeTable.putItem(verificationCode);
        } catch (DynamoDbException e) {
            logger.error("Failed to save verification code {}", verificationCode.getCodeKey(), e);
            throw new RepositoryException("Failed to save verification code", e);
        }
    }

    @Override
    public Optional<VerificationCode> find(CodeChannel channel, CodePurpose purpose, String target) {
        Key key = Key.builder()
                .partitionValue(VerificationCode.keyFor(channel, purpose, target))
                .build();
        try {
            return Optional.ofNullable(verificationCodeTable.getItem(key));
        } catch (DynamoDbException e) {
            logger.error("Failed to load verification code for {}/{}", channel, purpose, e);
            throw new RepositoryException("Failed to load verification code", e);
        }
    }

    @Override
    public void delete(CodeChannel channel, CodePurpose purpose, String target) {
        Key key = Key.builder()
                .partitionValue(VerificationCode.keyFor(channel, purpose, target))
                .build();
        try {
            verificationCodeTable.deleteItem(key);
        } catch (DynamoDbException e) {
            logger.error("Failed to delete verification code for {}/{}", channel, purpose, e);
            throw new RepositoryException("Failed to delete verification code", e);
        }
    }
}
