package com.easyinstall.backup;

import com.easyinstall.backup.dto.BackupJobRequest;
import com.easyinstall.backup.dto.CreateBackupRequest;
import com.easyinstall.backup.dto.JobStatusRequest;
import com.easyinstall.backup.model.BackupJob;
import com.easyinstall.backup.model.BackupResult;
import com.easyinstall.backup.model.CompletionEvent;
import com.easyinstall.backup.service.BackgroundOperationService;
import com.easyinstall.backup.service.BackupCatalogService;
import com.easyinstall.backup.service.BackupJobService;
import com.easyinstall.backup.service.BackupRunnerService;
import com.easyinstall.backup.service.NotificationChannel;
import com.easyinstall.backup.utils.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StopWatch;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class BackupController {

    private final BackupRunnerService backupRunnerService;
    private final BackupJobService backupJobService;
    private final BackupCatalogService backupCatalogService;
    private final BackgroundOperationService backgroundOperationService;
    private final NotificationChannel notificationChannel;

    @PostMapping("/api/backups/create")
    public Mono<Map<String, Object>> createBackup(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId,
                                                  @RequestBody(required = false) CreateBackupRequest request) {
        Long jobId = request == null ? null : request.getJobId();
        log.info("backup request received from operator {} for job {}", operatorId, jobId);
        return Mono.fromCallable(() -> {
            StopWatch stopWatch = new StopWatch();
            stopWatch.start();
            BackupResult result = runWithJobContext(operatorId, jobId);
            stopWatch.stop();
            log.info("Completion time - {} sec", stopWatch.getTotalTimeSeconds());
            return toResponse(result);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/backups/create/async")
    public Mono<ResponseEntity<Map<String, Object>>> createBackupAsync(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId,
                                                                       @RequestBody(required = false) CreateBackupRequest request) {
        Long jobId = request == null ? null : request.getJobId();
        return Mono.fromCallable(() -> {
            String operationId = backgroundOperationService.submit("backup", () -> {
                BackupResult result = runWithJobContext(operatorId, jobId);
                return result.getArtifactPath() + " (" + result.getSizeBytes() + " bytes) -> " + result.getLocations();
            });
            Map<String, Object> body = new LinkedHashMap<>();
            body.put(AppConstants.SUCCESS, true);
            body.put("operation_id", operationId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        });
    }

    @GetMapping("/api/backups/list")
    public Mono<List<Map<String, Object>>> listBackups() {
        return Mono.fromCallable(backupCatalogService::listBackups).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/backups/jobs")
    public Mono<List<BackupJob>> listJobs(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId) {
        return Mono.fromCallable(() -> backupJobService.listJobs(operatorId)).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/backups/jobs")
    public Mono<Map<String, Object>> createJob(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId,
                                               @RequestBody BackupJobRequest request) {
        return Mono.fromCallable(() -> {
            long id = backupJobService.createJob(operatorId, request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put(AppConstants.SUCCESS, true);
            body.put("id", id);
            return body;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PatchMapping("/api/backups/jobs/{id}/status")
    public Mono<Map<String, Object>> updateJobStatus(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId,
                                                     @PathVariable("id") Long jobId,
                                                     @RequestBody JobStatusRequest request) {
        return Mono.fromCallable(() -> {
            backupJobService.updateStatus(operatorId, jobId, request.getStatus());
            return Map.<String, Object>of(AppConstants.SUCCESS, true);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<CompletionEvent>> events() {
        return notificationChannel.events()
                .map(event -> ServerSentEvent.builder(event)
                        .id(event.getOperationId())
                        .event("operation_complete")
                        .build());
    }

    private BackupResult runWithJobContext(Long operatorId, Long jobId) {
        if (jobId != null) {
            MDC.put(AppConstants.MDC_JOB_ID, String.valueOf(jobId));
        }
        try {
            return backupRunnerService.createBackup(operatorId, jobId);
        } finally {
            MDC.remove(AppConstants.MDC_JOB_ID);
        }
    }

    private Map<String, Object> toResponse(BackupResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(AppConstants.SUCCESS, true);
        body.put("file", result.getArtifactPath().toString());
        body.put("size", result.getSizeBytes());
        body.put("locations", result.getLocations());
        return body;
    }
}
