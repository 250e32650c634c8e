package com.herzen.irt.repository;

import com.herzen.irt.jobs.JobModels.StoredDataset;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class DatasetJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public DatasetJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(StoredDataset dataset) {
        jdbcTemplate.update(
                "MERGE INTO datasets(session_id, file_name, content, created_at, expires_at) KEY(session_id) VALUES (?,?,?,?,?)",
                dataset.sessionId(), dataset.fileName(), dataset.content(),
                Timestamp.from(dataset.createdAt()), Timestamp.from(dataset.expiresAt()));
    }

    public Optional<StoredDataset> find(String sessionId, Instant now) {
        return jdbcTemplate.query(
                "SELECT session_id, file_name, content, created_at, expires_at FROM datasets WHERE session_id = ? AND expires_at > ?",
                (rs, n) -> new StoredDataset(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getTimestamp(4).toInstant(), rs.getTimestamp(5).toInstant()),
                sessionId, Timestamp.from(now)
        ).stream().findFirst();
    }

    public List<String> purgeExpired(Instant now) {
        List<String> expired = jdbcTemplate.queryForList(
                "SELECT session_id FROM datasets WHERE expires_at <= ?", String.class, Timestamp.from(now));
        expired.forEach(id -> jdbcTemplate.update("DELETE FROM datasets WHERE session_id = ?", id));
        return expired;
    }
}
