package com.hotride.auth.repository.impl;

import com.hotride.auth.exception.DuplicateIdentifierException;
import com.hotride.auth.exception.RepositoryException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AccountIdentifierClaim;
import com.hotride.auth.model.AuthProvider;
import com.hotride.auth.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.util.Optional;
import java.util.UUID;

/**
 * Accounts live in {@code Accounts}; email and verified phone uniqueness is enforced by claim items in
 * {@code AccountIdentifiers} written in the same transaction as the account.
 */
@Repository
public class AccountRepositoryImpl implements AccountRepository {

    static final String ACCOUNTS_TABLE = "Accounts";
    static final String IDENTIFIERS_TABLE = "AccountIdentifiers";

    private static final Logger logger = LoggerFactory.getLogger(AccountRepositoryImpl.class);

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<Account> accountTable;
    private final DynamoDbTable<AccountIdentifierClaim> identifierTable;
    private final DynamoDbIndex<Account> emailIndex;
    private final DynamoDbIndex<Account> phoneIndex;
    private final DynamoDbIndex<Account> providerSubjectIndex;

    @Autowired
    public AccountRepositoryImpl(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.accountTable = enhancedClient.table(ACCOUNTS_TABLE, TableSchema.fromBean(Account.class));
        this.identifierTable = enhancedClient.table(IDENTIFIERS_TABLE, TableSchema.fromBean(AccountIdentifierClaim.class));
        this.emailIndex = accountTable.index("EmailIndex");
        this.phoneIndex = accountTable.index("PhoneIndex");
        this.providerSubjectIndex = accountTable.index("ProviderSubjectIndex");
    }

    @Override
    public Account create(Account account) {
        AccountIdentifierClaim claim = AccountIdentifierClaim.forEmail(account.getEmail(), account.getId().toString());
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(identifierTable, TransactPutItemEnhancedRequest.builder(AccountIdentifierClaim.class)
                        .item(claim)
                        .conditionExpression(Expression.builder()
                                .expression("attribute_not_exists(identifier)")
                                .build())
                        .build())
                .addPutItem(accountTable, TransactPutItemEnhancedRequest.builder(Account.class)
                        .item(account)
                        .conditionExpression(Expression.builder()
                                .expression("attribute_not_exists(id)")
                                .build())
                        .build())
                .build();
        try {
            enhancedClient.transactWriteItems(request);
            logger.info("Created {} account {}", account.getAuthProvider(), account.getId());
            return account;
        } catch (TransactionCanceledException e) {
            logger.warn("Account creation lost identifier race for account {}", account.getId());
            throw new DuplicateIdentifierException("Email is already claimed by another account", e);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error creating account {}", account.getId(), e);
            throw new RepositoryException("Failed to create account", e);
        }
    }

    @Override
    public Account save(Account account) {
        try {
            account.touch();
            accountTable.putItem(account);
            return account;
        } catch (DynamoDbException e) {
            logger.error("Failed to save account {}", account.getId(), e);
            throw new RepositoryException("Failed to save account", e);
        }
    }

    @Override
    public Account saveWithPhoneClaim(Account account, String releasedPhone) {
        account.touch();
        String accountId = account.getId().toString();
        // Succeeds when the claim is absent or already ours.
        Expression ownClaimOrNone = Expression.builder()
                .expression("attribute_not_exists(identifier) OR accountId = :accountId")
                .putExpressionValue(":accountId", AttributeValue.builder().s(accountId).build())
                .build();

        String claimedPhone = Boolean.TRUE.equals(account.getPhoneVerified()) ? account.getPhone() : null;
        TransactWriteItemsEnhancedRequest.Builder request = TransactWriteItemsEnhancedRequest.builder();
        if (claimedPhone != null) {
            request.addPutItem(identifierTable, TransactPutItemEnhancedRequest.builder(AccountIdentifierClaim.class)
                    .item(AccountIdentifierClaim.forPhone(claimedPhone, accountId))
                    .conditionExpression(ownClaimOrNone)
                    .build());
        }
        if (releasedPhone != null && !releasedPhone.equals(claimedPhone)) {
            request.addDeleteItem(identifierTable, TransactDeleteItemEnhancedRequest.builder()
                    .key(Key.builder().partitionValue(AccountIdentifierClaim.phoneKey(releasedPhone)).build())
                    .conditionExpression(ownClaimOrNone)
                    .build());
        }
        request.addPutItem(accountTable, account);

        try {
            enhancedClient.transactWriteItems(request.build());
            logger.info("Saved phone claim for account {}", account.getId());
            return account;
        } catch (TransactionCanceledException e) {
            logger.warn("Phone claim for account {} lost to another account", account.getId());
            throw new DuplicateIdentifierException("Phone is already claimed by another account", e);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error saving phone claim for account {}", account.getId(), e);
            throw new RepositoryException("Failed to save account", e);
        }
    }

    @Override
    public Optional<Account> findById(UUID id) {
        try {
            return Optional.ofNullable(accountTable.getItem(Key.builder().partitionValue(id.toString()).build()));
        } catch (DynamoDbException e) {
            logger.error("Failed to load account {}", id, e);
            throw new RepositoryException("Failed to load account", e);
        }
    }

    @Override
    public Optional<Account> findByEmail(String email) {
        return queryFirst(emailIndex, email, "email");
    }

    @Override
    public Optional<Account> findByVerifiedPhone(String phone) {
        try {
            return phoneIndex.query(QueryConditional.keyEqualTo(Key.builder().partitionValue(phone).build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .filter(account -> Boolean.TRUE.equals(account.getPhoneVerified()))
                    .findFirst();
        } catch (DynamoDbException e) {
            logger.error("Failed to query accounts by phone", e);
            throw new RepositoryException("Failed to query accounts by phone", e);
        }
    }

    @Override
    public Optional<Account> findByProviderSubject(AuthProvider provider, String subject) {
        return queryFirst(providerSubjectIndex, Account.providerKey(provider, subject), "provider subject");
    }

    private Optional<Account> queryFirst(DynamoDbIndex<Account> index, String value, String description) {
        try {
            return index.query(QueryConditional.keyEqualTo(Key.builder().partitionValue(value).build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .findFirst();
        } catch (DynamoDbException e) {
            logger.error("Failed to query accounts by {}", description, e);
            throw new RepositoryException("Failed to query accounts by " + description, e);
        }
    }
}
