package com.easyinstall.backup.dao;

import com.easyinstall.backup.model.CredentialRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@JdbcTest
@Import(CloudCredentialDaoService.class)
@DisplayName("CloudCredentialDaoService Tests")
class CloudCredentialDaoServiceTest {

    @Autowired
    private CloudCredentialDaoService credentialDaoService;

    @Test
    @DisplayName("Should return the stored credential map unchanged")
    void should_RoundTripCredentials_When_Saved() {
        // Given
        Map<String, Object> s3 = Map.of("access_key", "A", "secret_key", "B", "region", "us-east-1");

        // When
        credentialDaoService.save(1L, "s3", s3, "primary", false);

        // Then
        CredentialRecord stored = credentialDaoService.find(1L, "s3").orElseThrow();
        assertEquals(s3, stored.getCredentials());
        assertEquals("primary", stored.getName());
        assertFalse(stored.isDefault());
        assertTrue(credentialDaoService.find(2L, "s3").isEmpty());
        assertTrue(credentialDaoService.find(1L, "gdrive").isEmpty());
    }

    @Test
    @DisplayName("Should replace the record when the same provider is saved twice")
    void should_Upsert_When_ProviderSavedAgain() {
        // Given
        credentialDaoService.save(1L, "rclone", Map.of("remote", "old"), null, false);

        // When
        credentialDaoService.save(1L, "rclone", Map.of("remote", "new", "type", "drive"), "second", false);

        // Then
        CredentialRecord stored = credentialDaoService.find(1L, "rclone").orElseThrow();
        assertEquals(Map.of("remote", "new", "type", "drive"), stored.getCredentials());
        assertEquals("second", stored.getName());
    }

    @Test
    @DisplayName("Should keep a single default per owner across providers")
    void should_MoveDefault_When_AnotherProviderMadeDefault() {
        // Given
        credentialDaoService.save(1L, "s3", Map.of("access_key", "A"), null, true);
        credentialDaoService.save(7L, "s3", Map.of("access_key", "other"), null, true);

        // When
        credentialDaoService.save(1L, "gdrive", Map.of("token", "t"), null, true);

        // Then
        Optional<CredentialRecord> defaultRecord = credentialDaoService.findDefault(1L);
        assertTrue(defaultRecord.isPresent());
        assertEquals("gdrive", defaultRecord.get().getProvider());
        assertFalse(credentialDaoService.find(1L, "s3").orElseThrow().isDefault());
        assertEquals("s3", credentialDaoService.findDefault(7L).orElseThrow().getProvider());
    }

    @Test
    @DisplayName("Should have no default when none was requested")
    void should_ReturnEmptyDefault_When_NoneFlagged() {
        // Given
        credentialDaoService.save(3L, "s3", Map.of("access_key", "A"), null, false);

        // When & Then
        assertTrue(credentialDaoService.findDefault(3L).isEmpty());
    }
}
