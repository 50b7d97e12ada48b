package com.easyinstall.backup.model;

import lombok.Value;

/**
 * Outcome of a single adapter invocation.
 */
@Value
public class UploadResult {
    String provider;
    boolean success;
    String location;
    String error;

    public static UploadResult success(String provider, String location) {
        return new UploadResult(provider, true, location, null);
    }

    public static UploadResult failure(String provider, String error) {
        return new UploadResult(provider, false, null, error);
    }
}
