package com.easyinstall.backup.service;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.dao.BackupHistoryDaoService;
import com.easyinstall.backup.model.BackupHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists local artifacts found under the backup directory followed by the
 * most recent history rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupCatalogService {

    private final BackupProperties properties;
    private final BackupHistoryDaoService historyDaoService;

    public List<Map<String, Object>> listBackups() {
        List<Map<String, Object>> backups = new ArrayList<>(listLocal());
        for (BackupHistoryEntry h : historyDaoService.findRecent(properties.getHistoryLimit())) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", h.getId());
            row.put("job_id", h.getJobId());
            row.put("start_time", h.getStartTime());
            row.put("end_time", h.getEndTime());
            row.put("size", h.getSize());
            row.put("status", h.getStatus());
            row.put("message", h.getMessage());
            row.put("locations", h.getLocations());
            row.put("type", "cloud");
            backups.add(row);
        }
        return backups;
    }

    List<Map<String, Object>> listLocal() {
        Path backupDir = Paths.get(properties.getBackupDir());
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(backupDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".tar.gz") || p.toString().endsWith(".sql"))
                    .sorted()
                    .map(this::describe)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Unable to scan backup directory {}", backupDir, e);
            throw new UncheckedIOException(e);
        }
    }

    private Map<String, Object> describe(Path path) {
        try {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", path.getFileName().toString());
            row.put("path", path.toString());
            row.put("size", Files.size(path));
            row.put("modified", LocalDateTime.ofInstant(Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault()));
            row.put("type", "local");
            return row;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
