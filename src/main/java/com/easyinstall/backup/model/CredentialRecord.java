package com.easyinstall.backup.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Builder
@Data
public class CredentialRecord {
    private Long id;
    private Long ownerId;
    private String provider;
    // opaque to the runner, interpreted by the matching upload adapter only
    private Map<String, Object> credentials;
    private String name;
    private boolean isDefault;
    private LocalDateTime createdAt;
}
