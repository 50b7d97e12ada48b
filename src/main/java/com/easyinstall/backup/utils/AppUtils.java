package com.easyinstall.backup.utils;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Slf4j
public class AppUtils {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern(AppConstants.TIMESTAMP_PATTERN);

    public static String timestamp(Clock clock) {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    }

    public static Path artifactPath(Path tempDir, Clock clock) {
        return tempDir.resolve(AppConstants.ARTIFACT_PREFIX + timestamp(clock) + AppConstants.ARTIFACT_SUFFIX);
    }

    public static String basename(Path file) {
        return file.getFileName().toString();
    }

    public static String getString(Map<String, Object> source, String key) {
        if (source == null) {
            return null;
        }
        Object value = source.get(key);
        return value == null ? null : value.toString();
    }

    public static String getString(Map<String, Object> source, String key, String defaultValue) {
        String value = getString(source, key);
        return value == null ? defaultValue : value;
    }
}
