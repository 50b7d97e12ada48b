package com.easyinstall.backup.service;

import com.easyinstall.backup.dto.BackupJobRequest;
import com.easyinstall.backup.model.ProviderTag;
import com.easyinstall.backup.utils.AppConstants;
import io.micrometer.common.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

@Service
@Slf4j
public class BackupValidationService {

    private static final Set<String> JOB_STATUSES = Set.of(
            AppConstants.JOB_ACTIVE_STATUS, AppConstants.JOB_INACTIVE_STATUS, AppConstants.JOB_DELETED_STATUS);

    public void validateOperator(Long operatorId) {
        if (operatorId == null) {
            throw new IllegalArgumentException("Operator id is required");
        }
    }

    public void validateJobRequest(BackupJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Backup job request cannot be empty");
        }
        validateRequired(request.getName(), "Job name");
        validateRequired(request.getType(), "Job type");
        if (request.getRetentionDays() != null && request.getRetentionDays() < 0) {
            throw new IllegalArgumentException("Retention days cannot be negative");
        }
        if (request.getDestination() != null) {
            request.getDestination().forEach(this::validateDestination);
        }
    }

    public void validateDestination(String provider, Map<String, Object> config) {
        ProviderTag tag = ProviderTag.fromTag(provider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + provider));
        if (tag == ProviderTag.S3) {
            validateParam(config, AppConstants.BUCKET, "s3 bucket");
        } else if (tag == ProviderTag.RCLONE) {
            validateParam(config, AppConstants.REMOTE, "rclone remote");
            validateParam(config, AppConstants.PATH, "rclone path");
        }
        // gdrive: folder_id is optional
    }

    public void validateJobStatus(String status) {
        if (status == null || !JOB_STATUSES.contains(status)) {
            throw new IllegalArgumentException("Status must be one of " + JOB_STATUSES);
        }
    }

    public void validateParam(Map<String, Object> params, String key, String description) {
        Object value = params == null ? null : params.get(key);
        if (value == null || (value instanceof String && StringUtils.isBlank((String) value))) {
            throw new IllegalArgumentException(description + " is required");
        }
    }

    private void validateRequired(String value, String description) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(description + " is required");
        }
    }
}
