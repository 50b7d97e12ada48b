package com.easyinstall.backup;

import com.easyinstall.backup.dto.BackupJobRequest;
import com.easyinstall.backup.exception.ResourceNotFoundException;
import com.easyinstall.backup.exception.SnapshotException;
import com.easyinstall.backup.model.BackupJob;
import com.easyinstall.backup.model.BackupResult;
import com.easyinstall.backup.service.BackgroundOperationService;
import com.easyinstall.backup.service.BackupCatalogService;
import com.easyinstall.backup.service.BackupJobService;
import com.easyinstall.backup.service.BackupRunnerService;
import com.easyinstall.backup.service.CloudCredentialService;
import com.easyinstall.backup.service.NotificationChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {BackupController.class, CloudController.class})
@DisplayName("Backup HTTP endpoints")
class BackupControllerTest {

    private static final String OPERATOR = "X-Operator-Id";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private BackupRunnerService backupRunnerService;
    @MockBean
    private BackupJobService backupJobService;
    @MockBean
    private BackupCatalogService backupCatalogService;
    @MockBean
    private BackgroundOperationService backgroundOperationService;
    @MockBean
    private NotificationChannel notificationChannel;
    @MockBean
    private CloudCredentialService cloudCredentialService;

    @Test
    @DisplayName("Should return file, size and locations for a job backup")
    void should_ReturnBackupResult_When_CreateSucceeds() {
        // Given
        when(backupRunnerService.createBackup(2L, 7L)).thenReturn(new BackupResult(
                Path.of("/tmp/easyinstall-webui/backup-20240305-080910.tar.gz"), 1024L, List.of("rclone://box:b/x")));

        // When & Then
        webTestClient.post().uri("/api/backups/create")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"job_id\": 7}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.file").isEqualTo("/tmp/easyinstall-webui/backup-20240305-080910.tar.gz")
                .jsonPath("$.size").isEqualTo(1024)
                .jsonPath("$.locations[0]").isEqualTo("rclone://box:b/x");
    }

    @Test
    @DisplayName("Should run an ad-hoc backup when no body is sent")
    void should_RunAdhocBackup_When_BodyMissing() {
        // Given
        when(backupRunnerService.createBackup(2L, null)).thenReturn(new BackupResult(
                Path.of("/tmp/a.tar.gz"), 1L, List.of()));

        // When & Then
        webTestClient.post().uri("/api/backups/create")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.locations").isEmpty();
    }

    @Test
    @DisplayName("Should map a snapshot failure to a 500 error body")
    void should_Return500_When_SnapshotFails() {
        // Given
        when(backupRunnerService.createBackup(2L, null))
                .thenThrow(new SnapshotException("Backup creation failed: disk full", 1));

        // When & Then
        webTestClient.post().uri("/api/backups/create")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("Backup creation failed: disk full");
    }

    @Test
    @DisplayName("Should keep the error body shape for unexpected failures")
    void should_Return500ErrorBody_When_RunnerThrowsUncheckedIo() {
        // Given
        when(backupRunnerService.createBackup(2L, null)).thenThrow(new UncheckedIOException(
                "Cannot create artifact directory: /tmp/easyinstall-webui", new IOException("Permission denied")));

        // When & Then
        webTestClient.post().uri("/api/backups/create")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("Cannot create artifact directory: /tmp/easyinstall-webui");
    }

    @Test
    @DisplayName("Should answer 400 with the error body when the operator header is missing")
    void should_Return400ErrorBody_When_OperatorHeaderMissing() {
        // When & Then
        webTestClient.post().uri("/api/backups/create")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
        verify(backupRunnerService, never()).createBackup(any(), any());
    }

    @Test
    @DisplayName("Should answer 202 with an operation id for async backups")
    void should_ReturnOperationId_When_AsyncRequested() {
        // Given
        when(backgroundOperationService.submit(eq("backup"), any())).thenReturn("op-1");

        // When & Then
        webTestClient.post().uri("/api/backups/create/async")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.operation_id").isEqualTo("op-1");
        verify(backupRunnerService, never()).createBackup(any(), any());
    }

    @Test
    @DisplayName("Should create a job from a snake case body")
    void should_CreateJob_When_BodyValid() {
        // Given
        when(backupJobService.createJob(eq(2L), any(BackupJobRequest.class))).thenReturn(12L);

        // When
        webTestClient.post().uri("/api/backups/jobs")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"nightly\",\"type\":\"full\",\"retention_days\":7,"
                        + "\"destination\":{\"s3\":{\"bucket\":\"b\"}}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(12);

        // Then
        ArgumentCaptor<BackupJobRequest> captor = ArgumentCaptor.forClass(BackupJobRequest.class);
        verify(backupJobService).createJob(eq(2L), captor.capture());
        assertEquals(7, captor.getValue().getRetentionDays());
        assertEquals(Map.of("bucket", "b"), captor.getValue().getDestination().get("s3"));
    }

    @Test
    @DisplayName("Should reject an invalid job with 400")
    void should_Return400_When_JobInvalid() {
        // Given
        when(backupJobService.createJob(eq(2L), any(BackupJobRequest.class)))
                .thenThrow(new IllegalArgumentException("Job name is required"));

        // When & Then
        webTestClient.post().uri("/api/backups/jobs")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"full\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Job name is required");
    }

    @Test
    @DisplayName("Should list the operator's jobs")
    void should_ListJobs_When_Requested() {
        // Given
        when(backupJobService.listJobs(2L)).thenReturn(List.of(BackupJob.builder()
                .id(1L).name("nightly").type("full").retentionDays(30).status("active").userId(2L).build()));

        // When & Then
        webTestClient.get().uri("/api/backups/jobs")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].name").isEqualTo("nightly")
                .jsonPath("$[0].retention_days").isEqualTo(30);
    }

    @Test
    @DisplayName("Should return 404 when the job to update is not the operator's")
    void should_Return404_When_JobStatusTargetMissing() {
        // Given
        doThrow(new ResourceNotFoundException("Backup job 9 not found"))
                .when(backupJobService).updateStatus(2L, 9L, "inactive");

        // When & Then
        webTestClient.patch().uri("/api/backups/jobs/9/status")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"status\":\"inactive\"}")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Should store provider credentials for the operator")
    void should_ConfigureProvider_When_Posted() {
        // When
        webTestClient.post().uri("/api/cloud/configure/rclone")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"remote\":\"box\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        // Then
        verify(cloudCredentialService).configure(eq(2L), eq("rclone"), anyMap());
    }

    @Test
    @DisplayName("Should reject unknown providers with 400")
    void should_Return400_When_ProviderUnknown() {
        // Given
        doThrow(new IllegalArgumentException("Unknown provider"))
                .when(cloudCredentialService).configure(eq(2L), eq("ftp"), anyMap());

        // When & Then
        webTestClient.post().uri("/api/cloud/configure/ftp")
                .header(OPERATOR, "2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unknown provider");
    }

    @Test
    @DisplayName("Should report per provider status")
    void should_ReturnStatus_When_Requested() {
        // Given
        when(cloudCredentialService.status(2L)).thenReturn(Map.of(
                "s3", Map.of("configured", true, "default", true)));

        // When & Then
        webTestClient.get().uri("/api/cloud/status")
                .header(OPERATOR, "2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.s3.configured").isEqualTo(true)
                .jsonPath("$.s3.default").isEqualTo(true);
    }
}
