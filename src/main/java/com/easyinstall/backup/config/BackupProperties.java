package com.easyinstall.backup.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "easyinstall.backup")
@Validated
public class BackupProperties {

    /** Where snapshot artifacts are written before upload. */
    @NotBlank
    private String tempDir = "/tmp/easyinstall-webui";

    /** Scanned for local artifacts when listing backups. */
    @NotBlank
    private String backupDir = "/backups";

    /** Snapshot command; the artifact path is appended as the last argument. */
    @NotEmpty
    private List<String> snapshotCommand = new ArrayList<>(List.of("easyinstall", "backup", "--output"));

    /** Zero disables the timeout. */
    private Duration commandTimeout = Duration.ZERO;

    @NotBlank
    private String rcloneBinary = "rclone";

    @Min(1)
    private int historyLimit = 50;

    @NotBlank
    private String defaultRegion = "us-east-1";

    private Drive drive = new Drive();

    private Http http = new Http();

    @Data
    public static class Drive {
        private String uploadUrl = "https://www.googleapis.com/upload/drive/v3/files";
    }

    @Data
    public static class Http {
        private int connectionTimeout = 30000;
        private int readTimeout = 300000;
    }
}
