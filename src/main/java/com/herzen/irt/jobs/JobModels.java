package com.herzen.irt.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

public class JobModels {
    public enum JobStatus {
        PENDING, PROCESSING, COMPLETED, ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    public record StatusRecord(String sessionId, JobStatus status, String message, Instant updatedAt) {}

    public record StoredDataset(String sessionId, String fileName, String content, Instant createdAt, Instant expiresAt) {}

    public record UploadResponse(String taskId, String sessionId, JobStatus status, String message) {}
}
