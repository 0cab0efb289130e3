package com.hotride.auth.model;

import com.hotride.auth.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.time.Instant;
import java.util.UUID;

/**
 * A rider's durable identity record.
 * <p>
 * {@link AuthProvider#EMAIL} accounts always carry an email and a BCrypt password hash.
 * Google and Apple accounts never carry a password; the provider vouches for the email at creation.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Account {

    private UUID id;
    private String email;
    private Boolean emailVerified;
    private String phone;
    private Boolean phoneVerified;
    private String passwordHash;
    private AuthProvider authProvider;
    private String providerKey;
    private String fullName;
    private String profilePictureRef;
    private Boolean active;
    private Instant profileCompletedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static Account forPasswordRegistration(String fullName, String email, String passwordHash) {
        Account account = newAccount(AuthProvider.EMAIL);
        account.setFullName(fullName);
        account.setEmail(email);
        account.setEmailVerified(false);
        account.setPasswordHash(passwordHash);
        return account;
    }

    public static Account forProvider(AuthProvider provider, String subject, String email,
                                      String fullName, String profilePictureRef) {
        if (!provider.isOAuth()) {
            throw new IllegalArgumentException("Provider accounts must use GOOGLE or APPLE, got " + provider);
        }
        Account account = newAccount(provider);
        account.setProviderKey(providerKey(provider, subject));
        account.setEmail(email);
        account.setEmailVerified(true);
        account.setFullName(fullName);
        account.setProfilePictureRef(profilePictureRef);
        return account;
    }

    private static Account newAccount(AuthProvider provider) {
        Account account = new Account();
        Instant now = Instant.now();
        account.setId(UUID.randomUUID());
        account.setAuthProvider(provider);
        account.setPhoneVerified(false);
        account.setActive(true);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        return account;
    }

    public static String providerKey(AuthProvider provider, String subject) {
        return provider.name() + "#" + subject;
    }

    @DynamoDbPartitionKey
    public UUID getId() {
        return id;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "EmailIndex")
    public String getEmail() {
        return email;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "PhoneIndex")
    public String getPhone() {
        return phone;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "ProviderSubjectIndex")
    public String getProviderKey() {
        return providerKey;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getProfileCompletedAt() {
        return profileCompletedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @DynamoDbIgnore
    public AccountState currentState() {
        return AccountState.of(this);
    }

    @DynamoDbIgnore
    public boolean hasPassword() {
        return passwordHash != null;
    }

    @DynamoDbIgnore
    public boolean isDisabled() {
        return Boolean.FALSE.equals(active);
    }

    /**
     * Advance {@code updatedAt}. Call before every save of a mutated account.
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", email='" + email + '\'' +
                ", authProvider=" + authProvider +
                ", emailVerified=" + emailVerified +
                ", phoneVerified=" + phoneVerified +
                ", passwordHash='[REDACTED]'" +
                '}';
    }
}
