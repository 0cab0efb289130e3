package com.hotride.auth.config;

import com.hotride.auth.model.Account;
import com.hotride.auth.model.AccountIdentifierClaim;
import com.hotride.auth.model.VerificationCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.List;

/**
 * Creates missing tables on startup for local development. Disabled in deployed environments with
 * {@code dynamodb.table.init.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists("Accounts", Account.class,
                List.of("EmailIndex", "PhoneIndex", "ProviderSubjectIndex"));
        createTableIfNotExists("AccountIdentifiers", AccountIdentifierClaim.class, List.of());
        createTableIfNotExists("VerificationCodes", VerificationCode.class, List.of());
    }

    private <T> void createTableIfNotExists(String tableName, Class<T> entityClass, List<String> indexNames) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            CreateTableEnhancedRequest.Builder requestBuilder = CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput());
            if (!indexNames.isEmpty()) {
                requestBuilder.globalSecondaryIndices(indexNames.stream().map(this::createGSI).toList());
            }
            table.createTable(requestBuilder.build());
            logger.info("Table {} created with indexes {}", tableName, indexNames);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
