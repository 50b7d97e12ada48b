package com.easyinstall.backup.service;

import com.easyinstall.backup.client.UploadAdapter;
import com.easyinstall.backup.dao.BackupHistoryDaoService;
import com.easyinstall.backup.dao.BackupJobDaoService;
import com.easyinstall.backup.dao.CloudCredentialDaoService;
import com.easyinstall.backup.exception.UploadException;
import com.easyinstall.backup.model.BackupHistoryEntry;
import com.easyinstall.backup.model.BackupJob;
import com.easyinstall.backup.model.BackupResult;
import com.easyinstall.backup.model.CredentialRecord;
import com.easyinstall.backup.model.UploadResult;
import com.easyinstall.backup.utils.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Creates a snapshot and fans it out to every destination configured on the
 * job. Upload failures are isolated per destination; a failed snapshot aborts
 * the attempt before anything is recorded.
 */
@Slf4j
@Service
public class BackupRunnerService {

    private final SnapshotProducer snapshotProducer;
    private final BackupJobDaoService jobDaoService;
    private final CloudCredentialDaoService credentialDaoService;
    private final BackupHistoryDaoService historyDaoService;
    private final UploadAdapterRegistry adapterRegistry;
    private final JobLockRegistry jobLockRegistry;
    private final Clock clock;

    public BackupRunnerService(SnapshotProducer snapshotProducer, BackupJobDaoService jobDaoService,
                               CloudCredentialDaoService credentialDaoService, BackupHistoryDaoService historyDaoService,
                               UploadAdapterRegistry adapterRegistry, JobLockRegistry jobLockRegistry, Clock clock) {
        this.snapshotProducer = snapshotProducer;
        this.jobDaoService = jobDaoService;
        this.credentialDaoService = credentialDaoService;
        this.historyDaoService = historyDaoService;
        this.adapterRegistry = adapterRegistry;
        this.jobLockRegistry = jobLockRegistry;
        this.clock = clock;
    }

    public BackupResult createBackup(Long ownerId, Long jobId) {
        return jobLockRegistry.withJobLock(jobId, () -> runBackup(ownerId, jobId));
    }

    private BackupResult runBackup(Long ownerId, Long jobId) {
        LocalDateTime startTime = LocalDateTime.now(clock);
        Path artifact = snapshotProducer.produce(snapshotProducer.nextArtifactPath());

        Map<String, Map<String, Object>> destinations = resolveDestinations(jobId);
        List<UploadResult> uploads = new ArrayList<>();
        destinations.forEach((provider, config) -> uploads.add(uploadTo(ownerId, provider, config, artifact)));

        List<String> locations = uploads.stream()
                .filter(UploadResult::isSuccess)
                .map(UploadResult::getLocation)
                .collect(Collectors.toList());
        long size = sizeOf(artifact);

        BackupHistoryEntry entry = BackupHistoryEntry.builder()
                .jobId(jobId)
                .startTime(startTime)
                .endTime(LocalDateTime.now(clock))
                .size(size)
                .status(AppConstants.BACKUP_COMPLETED_STATUS)
                .message(summarize(uploads))
                .locations(locations)
                .build();
        historyDaoService.record(entry);

        log.info("Backup {} completed: {} bytes, {} location(s)", artifact, size, locations.size());
        return new BackupResult(artifact, size, locations);
    }

    private Map<String, Map<String, Object>> resolveDestinations(Long jobId) {
        if (jobId == null) {
            return Map.of();
        }
        return jobDaoService.findById(jobId)
                .map(BackupJob::getDestination)
                .orElseGet(() -> {
                    log.warn("Backup job {} not found, keeping local artifact only", jobId);
                    return Map.of();
                });
    }

    UploadResult uploadTo(Long ownerId, String provider, Map<String, Object> config, Path artifact) {
        try {
            UploadAdapter adapter = adapterRegistry.resolve(provider)
                    .orElseThrow(() -> new UploadException(provider, "Unsupported provider: " + provider));
            Map<String, Object> credentials = credentialDaoService.find(ownerId, adapter.provider().getTag())
                    .map(CredentialRecord::getCredentials)
                    .orElse(null);
            String location = adapter.upload(artifact, config == null ? Map.of() : config, credentials);
            log.info("Backup uploaded to {}: {}", provider, location);
            return UploadResult.success(provider, location);
        } catch (Exception e) {
            log.error("Failed to upload to {}: {}", provider, e.getMessage(), e);
            return UploadResult.failure(provider, e.getMessage());
        }
    }

    static String summarize(List<UploadResult> uploads) {
        if (uploads.isEmpty()) {
            return "no destinations configured";
        }
        long succeeded = uploads.stream().filter(UploadResult::isSuccess).count();
        String summary = "uploaded " + succeeded + " of " + uploads.size() + " destination(s)";
        String failed = uploads.stream()
                .filter(u -> !u.isSuccess())
                .map(UploadResult::getProvider)
                .collect(Collectors.joining(", "));
        return failed.isEmpty() ? summary : summary + "; failed: " + failed;
    }

    private static long sizeOf(Path artifact) {
        try {
            return Files.size(artifact);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + artifact, e);
        }
    }
}
