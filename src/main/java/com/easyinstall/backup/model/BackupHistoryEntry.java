package com.easyinstall.backup.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Builder
@Data
public class BackupHistoryEntry {
    private Long id;
    private Long jobId;          // null for ad-hoc backups
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private long size;
    private String status;
    private String message;
    private List<String> locations;
}
