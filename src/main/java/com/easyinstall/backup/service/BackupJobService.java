package com.easyinstall.backup.service;

import com.easyinstall.backup.dao.BackupJobDaoService;
import com.easyinstall.backup.dto.BackupJobRequest;
import com.easyinstall.backup.exception.ResourceNotFoundException;
import com.easyinstall.backup.model.BackupJob;
import com.easyinstall.backup.utils.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BackupJobService {

    private final BackupJobDaoService jobDaoService;
    private final BackupValidationService validationService;

    public long createJob(Long ownerId, BackupJobRequest request) {
        validationService.validateJobRequest(request);
        BackupJob job = BackupJob.builder()
                .name(request.getName())
                .type(request.getType())
                .source(request.getSource())
                .destination(request.getDestination() == null ? new LinkedHashMap<>() : request.getDestination())
                .schedule(request.getSchedule())
                .retentionDays(request.getRetentionDays() == null ? AppConstants.DEFAULT_RETENTION_DAYS : request.getRetentionDays())
                .status(AppConstants.JOB_ACTIVE_STATUS)
                .userId(ownerId)
                .build();
        long id = jobDaoService.insert(job);
        log.info("Created backup job {} '{}' with destinations {}", id, job.getName(), job.getDestination().keySet());
        return id;
    }

    public List<BackupJob> listJobs(Long ownerId) {
        return jobDaoService.findByOwner(ownerId);
    }

    public void updateStatus(Long ownerId, Long jobId, String status) {
        validationService.validateJobStatus(status);
        if (!jobDaoService.updateStatus(ownerId, jobId, status)) {
            throw new ResourceNotFoundException("Backup job " + jobId + " not found");
        }
    }
}
