package com.hotride.auth.model;

import com.hotride.auth.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.Objects;

/**
 * The single live code for one (channel, purpose, target) slot. Issuing a new code overwrites the
 * slot; expired codes stay until overwritten and are rejected at redemption.
 */
@DynamoDbBean
public class VerificationCode {

    private String codeKey;
    private CodeChannel channel;
    private CodePurpose purpose;
    private String target;
    private String hashedCode;
    private Instant issuedAt;
    private Instant expiresAt;
    private Boolean consumed;
    private Boolean dispatched;
    private Integer failedAttempts;

    public VerificationCode() {
        this.consumed = false;
        this.dispatched = false;
        this.failedAttempts = 0;
    }

    public VerificationCode(CodeChannel channel, CodePurpose purpose, String target, String hashedCode,
                            Instant issuedAt, Instant expiresAt) {
        this();
        this.codeKey = keyFor(channel, purpose, target);
        this.channel = channel;
        this.purpose = purpose;
        this.target = target;
        this.hashedCode = hashedCode;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public static String keyFor(CodeChannel channel, CodePurpose purpose, String target) {
        return channel.name() + "#" + purpose.name() + "#" + target;
    }

    @DynamoDbPartitionKey
    public String getCodeKey() {
        return codeKey;
    }

    public void setCodeKey(String codeKey) {
        this.codeKey = codeKey;
    }

    public CodeChannel getChannel() {
        return channel;
    }

    public void setChannel(CodeChannel channel) {
        this.channel = channel;
    }

    public CodePurpose getPurpose() {
        return purpose;
    }

    public void setPurpose(CodePurpose purpose) {
        this.purpose = purpose;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getHashedCode() {
        return hashedCode;
    }

    public void setHashedCode(String hashedCode) {
        this.hashedCode = hashedCode;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(Instant issuedAt) {
        this.issuedAt = issuedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Boolean getConsumed() {
        return consumed;
    }

    public void setConsumed(Boolean consumed) {
        this.consumed = consumed;
    }

    public Boolean getDispatched() {
        return dispatched;
    }

    public void setDispatched(Boolean dispatched) {
        this.dispatched = dispatched;
    }

    public Integer getFailedAttempts() {
        return failedAttempts;
    }

    public void setFailedAttempts(Integer failedAttempts) {
        this.failedAttempts = failedAttempts;
    }

    @DynamoDbIgnore
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    @DynamoDbIgnore
    public boolean isLive() {
        return !Boolean.TRUE.equals(consumed);
    }

    public void incrementFailedAttempts() {
        this.failedAttempts = (this.failedAttempts == null ? 0 : this.failedAttempts) + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VerificationCode that = (VerificationCode) o;
        return Objects.equals(codeKey, that.codeKey) &&
                Objects.equals(hashedCode, that.hashedCode) &&
                Objects.equals(issuedAt, that.issuedAt) &&
                Objects.equals(expiresAt, that.expiresAt) &&
                Objects.equals(consumed, that.consumed) &&
                Objects.equals(failedAttempts, that.failedAttempts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(codeKey, hashedCode, issuedAt, expiresAt, consumed, failedAttempts);
    }

    @Override
    public String toString() {
        return "VerificationCode{" +
                "codeKey='" + codeKey + '\'' +
                ", hashedCode='[REDACTED]'" +
                ", issuedAt=" + issuedAt +
                ", expiresAt=" + expiresAt +
                ", consumed=" + consumed +
                ", failedAttempts=" + failedAttempts +
                '}';
    }
}
