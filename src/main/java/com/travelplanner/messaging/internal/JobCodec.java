package com.travelplanner.messaging.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.travelplanner.messaging.exception.JobSerializationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON wire format for job bodies.
 *
 * <p>Decoding is the validation boundary: malformed JSON, an unknown {@code type}
 * discriminator and Bean Validation violations all surface as
 * {@link JobSerializationException}.
 */
public class JobCodec {

    private final ObjectMapper objectMapper;

    @Nullable
    private final Validator validator;

    public JobCodec(ObjectMapper objectMapper, @Nullable Validator validator) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.validator = validator;
    }

    public byte[] encode(Object job) {
        if (job == null) {
            throw new JobSerializationException("Job must not be null");
        }
        try {
            return objectMapper.writeValueAsBytes(job);
        } catch (JsonProcessingException e) {
            throw new JobSerializationException(
                    "Failed to serialize job to JSON: " + job.getClass().getName(), e);
        }
    }

    public <T> T decode(byte[] body, Class<T> type) {
        if (body == null || body.length == 0) {
            throw new JobSerializationException("Empty job body");
        }

        T value;
        try {
            value = objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new JobSerializationException("Malformed job body for " + type.getSimpleName(), e);
        }

        if (value == null) {
            throw new JobSerializationException("Job body decoded to null for " + type.getSimpleName());
        }
        validate(value);
        return value;
    }

    /**
     * Copy of {@code job} as a JSON tree, including its type discriminator.
     */
    public ObjectNode toTree(Object job) {
        try {
            return objectMapper.valueToTree(job);
        } catch (IllegalArgumentException e) {
            throw new JobSerializationException(
                    "Failed to convert job to JSON tree: " + job.getClass().getName(), e);
        }
    }

    private <T> void validate(T value) {
        if (validator == null) {
            return;
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new JobSerializationException("Invalid job payload: " + details);
        }
    }
}
