package com.hotride.auth.repository.impl;

import com.hotride.auth.exception.RepositoryException;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import com.hotride.auth.model.VerificationCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VerificationCodeRepositoryImplTest {

    private static final String EMAIL = "jane@example.com";

    @Mock
    private DynamoDbEnhancedClient mockEnhancedClient;

    @Mock
    private DynamoDbTable<VerificationCode> mockDynamoDbTable;

    private VerificationCodeRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        when(mockEnhancedClient.table(eq("VerificationCodes"), any(TableSchema.class)))
                .thenReturn(mockDynamoDbTable);

        repository = new VerificationCodeRepositoryImpl(mockEnhancedClient);
    }

    private static VerificationCode code() {
        Instant now = Instant.now();
        return new VerificationCode(CodeChannel.EMAIL, CodePurpose.VERIFY, EMAIL, "hashedCode", now, now.plusSeconds(600));
    }

    @Test
    void save_WithVerificationCode_CallsPutItem() {
        // Given
        VerificationCode verificationCode = code();

        // When
        repository.save(verificationCode);

        // Then
        ArgumentCaptor<VerificationCode> captor = ArgumentCaptor.forClass(VerificationCode.class);
        verify(mockDynamoDbTable).putItem(captor.capture());
        assertThat(captor.getValue().getCodeKey()).isEqualTo("EMAIL#VERIFY#jane@example.com");
        assertThat(captor.getValue().getFailedAttempts()).isZero();
    }

    @Test
    void find_UsesChannelPurposeTargetKey() {
        // Given
        when(mockDynamoDbTable.getItem(any(Key.class))).thenReturn(code());

        // When
        Optional<VerificationCode> result = repository.find(CodeChannel.EMAIL, CodePurpose.VERIFY, EMAIL);

        // Then
        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        verify(mockDynamoDbTable).getItem(keyCaptor.capture());
        assertThat(keyCaptor.getValue().partitionKeyValue().s()).isEqualTo("EMAIL#VERIFY#jane@example.com");
        assertThat(result).isPresent();
    }

    @Test
    void find_WhenTableReturnsNull_ReturnsEmptyOptional() {
        // Given
        when(mockDynamoDbTable.getItem(any(Key.class))).thenReturn(null);

        // When
        Optional<VerificationCode> result = repository.find(CodeChannel.PHONE, CodePurpose.VERIFY, "+15551234567");

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    void delete_UsesSlotKey() {
        // When
        repository.delete(CodeChannel.EMAIL, CodePurpose.PASSWORD_RESET, EMAIL);

        // Then
        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        verify(mockDynamoDbTable).deleteItem(keyCaptor.capture());
        assertThat(keyCaptor.getValue().partitionKeyValue().s()).isEqualTo("EMAIL#PASSWORD_RESET#jane@example.com");
    }

    @Test
    void save_WhenDynamoDbFails_ThrowsRepositoryException() {
        // Given
        doThrow(DynamoDbException.builder().message("Throughput exceeded").build())
                .when(mockDynamoDbTable).putItem(any(VerificationCode.class));

        // When / Then
        assertThatThrownBy(() -> repository.save(code()))
                .isInstanceOf(RepositoryException.class)
                .hasCauseInstanceOf(DynamoDbException.class);
    }
}
