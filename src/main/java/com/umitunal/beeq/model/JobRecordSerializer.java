package com.umitunal.beeq.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.beeq.core.Job;
import com.umitunal.beeq.exception.SerializationException;

import java.io.IOException;

/**
 * JSON serializer for {@link JobRecord}.
 *
 * Document layout:
 * <pre>
 * {
 *   "id": "...", "payload": "&lt;base64&gt;", "status": "WAITING",
 *   "attempts": 0, "max_retries": 3, "timeout": 60000, "backoff_base": 2000,
 *   "created_at": 1700000000000, "updated_at": 1700000000000,
 *   "error": null, "result": null
 * }
 * </pre>
 * The serialized text doubles as the list element, so equal records must produce equal text.
 */
public class JobRecordSerializer {

    private final ObjectMapper mapper;

    public JobRecordSerializer() {
        this(new ObjectMapper());
    }

    public JobRecordSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serialize a record to its JSON text.
     */
    public String serialize(JobRecord record) throws SerializationException {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", record.getId());
        node.put("payload", record.getPayload());
        node.put("status", record.getStatus().name());
        node.put("attempts", record.getAttempts());
        node.put("max_retries", record.getMaxRetries());
        node.put("timeout", record.getTimeoutMillis());
        node.put("backoff_base", record.getBackoffBaseMillis());
        node.put("created_at", record.getCreatedAt());
        node.put("updated_at", record.getUpdatedAt());
        node.put("error", record.getError());
        node.put("result", record.getResult());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize job " + record.getId(), e);
        }
    }

    /**
     * Rebuild a record from its JSON text.
     */
    public JobRecord deserialize(String json) throws SerializationException {
        if (json == null) {
            throw new SerializationException("Cannot deserialize null job record");
        }

        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed job record", e);
        }
        if (node == null || !node.isObject()) {
            throw new SerializationException("Job record is not a JSON object");
        }

        try {
            JobRecord record = new JobRecord(
                    required(node, "id").asText(),
                    required(node, "payload").binaryValue(),
                    required(node, "max_retries").asInt(),
                    required(node, "timeout").asLong(),
                    required(node, "backoff_base").asLong(),
                    required(node, "created_at").asLong());

            record.setStatus(Job.Status.valueOf(required(node, "status").asText()));
            record.setAttempts(required(node, "attempts").asInt());
            record.setUpdatedAt(required(node, "updated_at").asLong());
            record.setError(optionalText(node, "error"));
            record.setResult(optionalText(node, "result"));
            return record;
        } catch (IOException | IllegalArgumentException e) {
            throw new SerializationException("Invalid job record: " + e.getMessage(), e);
        }
    }

    private static JsonNode required(JsonNode node, String field) throws SerializationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SerializationException("Job record is missing field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
