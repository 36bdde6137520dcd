package com.umitunal.beeq.model;

import com.umitunal.beeq.core.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobRecordTest {

    @Test
    @DisplayName("Should create a waiting record with defaults")
    void testCreate() {
        // When
        JobRecord record = JobRecord.create("hello".getBytes(UTF_8), 3);

        // Then
        assertThat(record.getId()).isNotBlank();
        assertThat(record.getStatus()).isEqualTo(Job.Status.WAITING);
        assertThat(record.getAttempts()).isZero();
        assertThat(record.getMaxRetries()).isEqualTo(3);
        assertThat(record.getTimeoutMillis()).isEqualTo(JobRecord.DEFAULT_TIMEOUT_MILLIS);
        assertThat(record.getBackoffBaseMillis()).isEqualTo(JobRecord.DEFAULT_BACKOFF_BASE_MILLIS);
        assertThat(record.getCreatedAt()).isEqualTo(record.getUpdatedAt());
        assertThat(record.getError()).isNull();
    }

    @Test
    @DisplayName("Should generate distinct ids")
    void testUniqueIds() {
        JobRecord first = JobRecord.create(new byte[0], 1);
        JobRecord second = JobRecord.create(new byte[0], 1);

        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    @DisplayName("Should allow retry only while attempts are below the limit")
    void testCanRetry() {
        // Given
        JobRecord record = JobRecord.create(new byte[0], 2);

        // When / Then
        assertThat(record.canRetry()).isTrue();
        record.incrementAttempts();
        assertThat(record.canRetry()).isTrue();
        record.incrementAttempts();
        assertThat(record.canRetry()).isFalse();
    }

    @Test
    @DisplayName("Should never retry a record with a zero limit")
    void testZeroRetries() {
        assertThat(JobRecord.create(new byte[0], 0).canRetry()).isFalse();
    }

    @Test
    @DisplayName("Should count an attempt and flag retrying on incrementRetry")
    void testIncrementRetry() {
        // Given
        JobRecord record = JobRecord.create(new byte[0], 3);

        // When
        record.incrementRetry();

        // Then
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.getStatus()).isEqualTo(Job.Status.RETRYING);
    }

    @Test
    @DisplayName("Should advance updatedAt on every transition")
    void testUpdatedAtAdvances() {
        // Given
        JobRecord record = JobRecord.create(new byte[0], 5);
        long previous = record.getUpdatedAt();

        // When / Then
        record.markProcessing();
        assertThat(record.getUpdatedAt()).isGreaterThan(previous);
        previous = record.getUpdatedAt();

        record.markRetrying("first");
        assertThat(record.getUpdatedAt()).isGreaterThan(previous);
        previous = record.getUpdatedAt();

        record.incrementAttempts();
        assertThat(record.getUpdatedAt()).isGreaterThan(previous);
        previous = record.getUpdatedAt();

        record.markCompleted("done");
        assertThat(record.getUpdatedAt()).isGreaterThan(previous);
    }

    @Test
    @DisplayName("Should set the error only on failure transitions")
    void testErrorField() {
        // Given
        JobRecord record = JobRecord.create(new byte[0], 1);

        // When
        record.markProcessing();

        // Then
        assertThat(record.getError()).isNull();

        record.markFailed("SMTP 550");
        assertThat(record.getStatus()).isEqualTo(Job.Status.FAILED);
        assertThat(record.getError()).isEqualTo("SMTP 550");
        assertThat(record.getStatus().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Should keep the handler result on completion")
    void testCompleted() {
        JobRecord record = JobRecord.create(new byte[0], 1);

        record.markCompleted("message-id-42");

        assertThat(record.getStatus()).isEqualTo(Job.Status.COMPLETED);
        assertThat(record.getResult()).isEqualTo("message-id-42");
    }

    @Test
    @DisplayName("Should build the storage key from queue key and id")
    void testStorageKey() {
        JobRecord record = JobRecord.create(new byte[0], 1);

        assertThat(record.storageKey("production_email_queue"))
                .isEqualTo("production_email_queue:job:" + record.getId());
    }

    @Test
    @DisplayName("Should reject a negative retry limit")
    void testNegativeRetries() {
        assertThatThrownBy(() -> JobRecord.create(new byte[0], -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
