package com.easyinstall.backup.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * What a caller gets back from one backup attempt. Only successful upload
 * locations are listed.
 */
@Value
public class BackupResult {
    Path artifactPath;
    long sizeBytes;
    List<String> locations;
}
