package com.easyinstall.backup.dao;

import com.easyinstall.backup.exception.StoreException;
import com.easyinstall.backup.model.BackupHistoryEntry;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of backup attempts. Rows are never updated.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class BackupHistoryDaoService {

    private static final TypeReference<List<String>> LOCATIONS_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${data.history-insert.query}")
    String insertHistory;

    @Value("${data.history-list.query}")
    String listHistory;

    @Value("${data.history-count-by-job.query}")
    String countByJob;

    @Value("${data.history-count-adhoc.query}")
    String countAdhoc;

    public long record(BackupHistoryEntry entry) {
        log.info("Inserting data in Backup History Table for job {}", entry.getJobId());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", entry.getJobId())
                .addValue("startTime", toTimestamp(entry.getStartTime()))
                .addValue("endTime", toTimestamp(entry.getEndTime()))
                .addValue("size", entry.getSize())
                .addValue("status", entry.getStatus())
                .addValue("message", entry.getMessage())
                .addValue("location", toJson(entry.getLocations()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(insertHistory, params, keyHolder, new String[]{"id"});
        } catch (DataAccessException e) {
            log.error("Unable to Insert data in Backup History Table ", e);
            throw new StoreException("Unable to Insert data in Backup History Table", e);
        }
        return keyHolder.getKey().longValue();
    }

    public List<BackupHistoryEntry> findRecent(int limit) {
        try {
            return jdbcTemplate.query(listHistory, new MapSqlParameterSource("limit", limit), rowMapper());
        } catch (DataAccessException e) {
            log.error("Unable to read Backup History Table", e);
            throw new StoreException("Unable to read backup history", e);
        }
    }

    public long countByJob(Long jobId) {
        try {
            Long count = jobId == null
                    ? jdbcTemplate.queryForObject(countAdhoc, new MapSqlParameterSource(), Long.class)
                    : jdbcTemplate.queryForObject(countByJob, new MapSqlParameterSource("jobId", jobId), Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            log.error("Unable to count history for job {}", jobId, e);
            throw new StoreException("Unable to count backup history", e);
        }
    }

    private RowMapper<BackupHistoryEntry> rowMapper() {
        return (rs, rowNum) -> BackupHistoryEntry.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getObject("job_id", Long.class))
                .startTime(toLocal(rs.getTimestamp("start_time")))
                .endTime(toLocal(rs.getTimestamp("end_time")))
                .size(rs.getLong("size"))
                .status(rs.getString("status"))
                .message(rs.getString("message"))
                .locations(fromJson(rs.getString("location")))
                .build();
    }

    private static Timestamp toTimestamp(LocalDateTime time) {
        return time == null ? null : Timestamp.valueOf(time);
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }

    private String toJson(List<String> locations) {
        try {
            return mapper.writeValueAsString(locations == null ? List.of() : locations);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Locations are not serializable", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return mapper.readValue(json, LOCATIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored locations are not valid JSON", e);
        }
    }
}
