package com.herzen.irt.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.irt.analysis.AnalysisModels.AnalysisResult;
import com.herzen.irt.jobs.JobModels.JobStatus;
import com.herzen.irt.jobs.JobModels.StatusRecord;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class AnalysisResultJdbcRepository {
    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AnalysisResultJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void saveResult(String sessionId, AnalysisResult result, Instant createdAt, Instant expiresAt) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Cannot serialize analysis result for " + sessionId, e);
        }
        jdbcTemplate.update(
                "MERGE INTO analysis_results(session_id, payload, created_at, expires_at) KEY(session_id) VALUES (?,?,?,?)",
                sessionId, payload, Timestamp.from(createdAt), Timestamp.from(expiresAt));
    }

    public Optional<AnalysisResult> findResult(String sessionId, Instant now) {
        return jdbcTemplate.queryForList(
                "SELECT payload FROM analysis_results WHERE session_id = ? AND expires_at > ?",
                String.class, sessionId, Timestamp.from(now)
        ).stream().findFirst().map(payload -> read(sessionId, payload));
    }

    public void saveStatus(String sessionId, JobStatus status, String message, Instant updatedAt, Instant expiresAt) {
        jdbcTemplate.update(
                "MERGE INTO analysis_status(session_id, status, message, updated_at, expires_at) KEY(session_id) VALUES (?,?,?,?,?)",
                sessionId, status.name(), truncate(message), Timestamp.from(updatedAt), Timestamp.from(expiresAt));
    }

    /**
     * Marks a job that is still pending or processing as processing with a new message. Returns
     * {@code false} when the job already finished, leaving its status untouched.
     */
    public boolean markStillRunning(String sessionId, String message, Instant updatedAt) {
        return jdbcTemplate.update(
                "UPDATE analysis_status SET status = ?, message = ?, updated_at = ? WHERE session_id = ? AND status IN (?, ?)",
                JobStatus.PROCESSING.name(), truncate(message), Timestamp.from(updatedAt), sessionId,
                JobStatus.PENDING.name(), JobStatus.PROCESSING.name()) > 0;
    }

    public Optional<StatusRecord> findStatus(String sessionId, Instant now) {
        return jdbcTemplate.query(
                "SELECT session_id, status, message, updated_at FROM analysis_status WHERE session_id = ? AND expires_at > ?",
                (rs, n) -> new StatusRecord(rs.getString(1), JobStatus.valueOf(rs.getString(2)), rs.getString(3),
                        rs.getTimestamp(4).toInstant()),
                sessionId, Timestamp.from(now)
        ).stream().findFirst();
    }

    public int purgeExpired(Instant now) {
        Timestamp cutoff = Timestamp.from(now);
        return jdbcTemplate.update("DELETE FROM analysis_results WHERE expires_at <= ?", cutoff)
                + jdbcTemplate.update("DELETE FROM analysis_status WHERE expires_at <= ?", cutoff);
    }

    private String truncate(String message) {
        return message != null && message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }

    private AnalysisResult read(String sessionId, String payload) {
        try {
            return objectMapper.readValue(payload, AnalysisResult.class);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored analysis result for " + sessionId + " is unreadable", e);
        }
    }
}
