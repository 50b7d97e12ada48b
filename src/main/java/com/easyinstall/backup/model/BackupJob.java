package com.easyinstall.backup.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A named backup definition. The schedule, last run and next run columns are
 * stored as given; nothing evaluates them.
 */
@Builder
@Data
public class BackupJob {
    private Long id;
    private String name;
    private String type;
    private String source;
    private Map<String, Map<String, Object>> destination;
    private String schedule;
    private Integer retentionDays;
    private LocalDateTime lastRun;
    private LocalDateTime nextRun;
    private String status;
    private LocalDateTime createdAt;
    private Long userId;
}
