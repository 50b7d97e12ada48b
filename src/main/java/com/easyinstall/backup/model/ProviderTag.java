package com.easyinstall.backup.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Upload destinations understood by the backup runner. The tag doubles as the
 * scheme of every location URI the matching adapter produces.
 */
public enum ProviderTag {
    S3("s3"),
    GDRIVE("gdrive"),
    RCLONE("rclone");

    private static final String SCHEME_SEPARATOR = "://";

    private final String tag;

    ProviderTag(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public String location(String path) {
        return tag + SCHEME_SEPARATOR + path;
    }

    public static Optional<ProviderTag> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.tag.equals(normalized))
                .findFirst();
    }

    public static ProviderTag fromLocation(String location) {
        int idx = location == null ? -1 : location.indexOf(SCHEME_SEPARATOR);
        if (idx <= 0) {
            throw new IllegalArgumentException("Not a location URI: " + location);
        }
        String scheme = location.substring(0, idx);
        return Arrays.stream(values())
                .filter(p -> p.tag.equals(scheme))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown location scheme: " + scheme));
    }

    @Override
    public String toString() {
        return tag;
    }
}
