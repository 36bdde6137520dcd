package com.umitunal.beeq.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.beeq.core.Job;
import com.umitunal.beeq.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    private final JobRecordSerializer serializer = new JobRecordSerializer();

    @Test
    @DisplayName("Should preserve all fields of a record that went through a retry")
    void testMetadataPreservation() throws Exception {
        // Given
        JobRecord original = JobRecord.create("{\"to\":\"a@example.com\"}".getBytes(UTF_8), 5, 1500, 250);
        original.incrementAttempts();
        original.markProcessing();
        original.markRetrying("Connection reset");

        // When
        JobRecord restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo(original.getId());
        assertThat(restored.getPayload()).isEqualTo(original.getPayload());
        assertThat(restored.getStatus()).isEqualTo(Job.Status.RETRYING);
        assertThat(restored.getAttempts()).isEqualTo(1);
        assertThat(restored.getMaxRetries()).isEqualTo(5);
        assertThat(restored.getTimeoutMillis()).isEqualTo(1500);
        assertThat(restored.getBackoffBaseMillis()).isEqualTo(250);
        assertThat(restored.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(restored.getUpdatedAt()).isEqualTo(original.getUpdatedAt());
        assertThat(restored.getError()).isEqualTo("Connection reset");
        assertThat(restored.getResult()).isNull();
    }

    @Test
    @DisplayName("Should write snake_case fields with a base64 payload")
    void testDocumentLayout() throws Exception {
        // Given
        JobRecord record = JobRecord.create(new byte[]{1, 2, 3}, 3);

        // When
        JsonNode node = new ObjectMapper().readTree(serializer.serialize(record));

        // Then
        assertThat(node.get("id").asText()).isEqualTo(record.getId());
        assertThat(node.get("payload").asText()).isEqualTo("AQID");
        assertThat(node.get("status").asText()).isEqualTo("WAITING");
        assertThat(node.get("max_retries").asInt()).isEqualTo(3);
        assertThat(node.has("backoff_base")).isTrue();
        assertThat(node.has("created_at")).isTrue();
        assertThat(node.get("error").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should produce identical text for an unchanged record")
    void testStableText() throws Exception {
        JobRecord record = JobRecord.create("x".getBytes(UTF_8), 1);

        assertThat(serializer.serialize(record)).isEqualTo(serializer.serialize(record));
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void testMalformed() {
        assertThatThrownBy(() -> serializer.deserialize("{not json"))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Should reject a document missing required fields")
    void testMissingField() {
        assertThatThrownBy(() -> serializer.deserialize("{\"id\":\"abc\",\"payload\":\"\"}"))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("max_retries");
    }

    @Test
    @DisplayName("Should reject an unknown status")
    void testUnknownStatus() throws Exception {
        String json = serializer.serialize(JobRecord.create(new byte[0], 1))
                .replace("\"WAITING\"", "\"PAUSED\"");

        assertThatThrownBy(() -> serializer.deserialize(json))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Should reject null input")
    void testNull() {
        assertThatThrownBy(() -> serializer.deserialize(null))
                .isInstanceOf(SerializationException.class);
    }
}
