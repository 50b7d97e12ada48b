package com.easyinstall.backup.dao;

import com.easyinstall.backup.exception.StoreException;
import com.easyinstall.backup.model.BackupJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class BackupJobDaoService {

    private static final TypeReference<Map<String, Map<String, Object>>> DESTINATION_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${data.job-insert.query}")
    String insertJob;

    @Value("${data.job-find.query}")
    String findJob;

    @Value("${data.job-list.query}")
    String listJobs;

    @Value("${data.job-update-status.query}")
    String updateJobStatus;

    public long insert(BackupJob job) {
        log.info("Inserting backup job '{}' for user {}", job.getName(), job.getUserId());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", job.getName())
                .addValue("type", job.getType())
                .addValue("source", job.getSource())
                .addValue("destination", toJson(job.getDestination()))
                .addValue("schedule", job.getSchedule())
                .addValue("retentionDays", job.getRetentionDays())
                .addValue("status", job.getStatus())
                .addValue("userId", job.getUserId());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(insertJob, params, keyHolder, new String[]{"id"});
        } catch (DataAccessException e) {
            log.error("Unable to insert backup job '{}'", job.getName(), e);
            throw new StoreException("Unable to insert backup job " + job.getName(), e);
        }
        return keyHolder.getKey().longValue();
    }

    public Optional<BackupJob> findById(Long id) {
        try {
            return jdbcTemplate.query(findJob, new MapSqlParameterSource("id", id), rowMapper())
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            log.error("Unable to read backup job {}", id, e);
            throw new StoreException("Unable to read backup job " + id, e);
        }
    }

    public List<BackupJob> findByOwner(Long ownerId) {
        try {
            return jdbcTemplate.query(listJobs, new MapSqlParameterSource("userId", ownerId), rowMapper());
        } catch (DataAccessException e) {
            log.error("Unable to list backup jobs for user {}", ownerId, e);
            throw new StoreException("Unable to list backup jobs", e);
        }
    }

    public boolean updateStatus(Long ownerId, Long id, String status) {
        log.info("Updating status of backup job {} to {}", id, status);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("userId", ownerId)
                .addValue("status", status);
        try {
            return jdbcTemplate.update(updateJobStatus, params) > 0;
        } catch (DataAccessException e) {
            log.error("Unable to update status of backup job {}", id, e);
            throw new StoreException("Unable to update backup job " + id, e);
        }
    }

    private RowMapper<BackupJob> rowMapper() {
        return (rs, rowNum) -> BackupJob.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .type(rs.getString("type"))
                .source(rs.getString("source"))
                .destination(fromJson(rs.getString("destination")))
                .schedule(rs.getString("schedule"))
                .retentionDays(rs.getObject("retention_days", Integer.class))
                .lastRun(toLocal(rs.getTimestamp("last_run")))
                .nextRun(toLocal(rs.getTimestamp("next_run")))
                .status(rs.getString("status"))
                .createdAt(toLocal(rs.getTimestamp("created_at")))
                .userId(rs.getObject("user_id", Long.class))
                .build();
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }

    private String toJson(Map<String, Map<String, Object>> destination) {
        try {
            return mapper.writeValueAsString(destination == null ? Map.of() : destination);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Destination config is not serializable", e);
        }
    }

    private Map<String, Map<String, Object>> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return mapper.readValue(json, DESTINATION_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored destination config is not valid JSON", e);
        }
    }
}
