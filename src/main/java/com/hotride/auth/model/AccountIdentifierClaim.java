package com.hotride.auth.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Uniqueness marker for a login identifier. Written in the same transaction as the account it
 * points to, guarded by {@code attribute_not_exists(identifier)}, so two registrations racing on
 * one email, or two riders verifying one phone, cannot both succeed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class AccountIdentifierClaim {

    private String identifier;
    private String accountId;

    public static AccountIdentifierClaim forEmail(String email, String accountId) {
        return new AccountIdentifierClaim("EMAIL#" + email, accountId);
    }

    public static AccountIdentifierClaim forPhone(String phone, String accountId) {
        return new AccountIdentifierClaim(phoneKey(phone), accountId);
    }

    public static String phoneKey(String phone) {
        return "PHONE#" + phone;
    }

    @DynamoDbPartitionKey
    public String getIdentifier() {
        return identifier;
    }
}
