package com.easyinstall.backup.dao;

import com.easyinstall.backup.exception.StoreException;
import com.easyinstall.backup.model.CredentialRecord;
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
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-operator cloud credentials. The default flag is owner-wide: marking a
 * record default clears the flag on every other provider of the same owner.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CloudCredentialDaoService {

    private static final TypeReference<Map<String, Object>> CREDENTIALS_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${data.credential-find.query}")
    String findCredentials;

    @Value("${data.credential-find-default.query}")
    String findDefaultCredentials;

    @Value("${data.credential-clear-default.query}")
    String clearDefault;

    @Value("${data.credential-update.query}")
    String updateCredentials;

    @Value("${data.credential-insert.query}")
    String insertCredentials;

    public Optional<CredentialRecord> find(Long ownerId, String provider) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", ownerId)
                .addValue("provider", provider);
        try {
            List<CredentialRecord> rows = jdbcTemplate.query(findCredentials, params, rowMapper());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Unable to read {} credentials for user {}", provider, ownerId, e);
            throw new StoreException("Unable to read credentials for provider " + provider, e);
        }
    }

    public Optional<CredentialRecord> findDefault(Long ownerId) {
        try {
            List<CredentialRecord> rows = jdbcTemplate.query(findDefaultCredentials,
                    new MapSqlParameterSource("userId", ownerId), rowMapper());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Unable to read default credentials for user {}", ownerId, e);
            throw new StoreException("Unable to read default credentials", e);
        }
    }

    @Transactional
    public void save(Long ownerId, String provider, Map<String, Object> credentials, String name, boolean makeDefault) {
        log.info("Saving {} credentials for user {} (default={})", provider, ownerId, makeDefault);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", ownerId)
                .addValue("provider", provider)
                .addValue("credentials", toJson(credentials))
                .addValue("name", name)
                .addValue("isDefault", makeDefault);
        try {
            if (makeDefault) {
                jdbcTemplate.update(clearDefault, params);
            }
            if (jdbcTemplate.update(updateCredentials, params) == 0) {
                jdbcTemplate.update(insertCredentials, params);
            }
        } catch (DataAccessException e) {
            log.error("Unable to save {} credentials for user {}", provider, ownerId, e);
            throw new StoreException("Unable to save credentials for provider " + provider, e);
        }
    }

    private RowMapper<CredentialRecord> rowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return CredentialRecord.builder()
                    .id(rs.getLong("id"))
                    .ownerId(rs.getLong("user_id"))
                    .provider(rs.getString("provider"))
                    .credentials(fromJson(rs.getString("credentials")))
                    .name(rs.getString("name"))
                    .isDefault(rs.getBoolean("is_default"))
                    .createdAt(createdAt == null ? null : createdAt.toLocalDateTime())
                    .build();
        };
    }

    private String toJson(Map<String, Object> credentials) {
        try {
            return mapper.writeValueAsString(credentials);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credentials are not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return mapper.readValue(json, CREDENTIALS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored credentials are not valid JSON", e);
        }
    }
}
