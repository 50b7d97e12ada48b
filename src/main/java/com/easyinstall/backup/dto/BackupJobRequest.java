package com.easyinstall.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupJobRequest {
    private String name;
    private String type;
    private String source;
    private Map<String, Map<String, Object>> destination;
    private String schedule;
    private Integer retentionDays;
}
