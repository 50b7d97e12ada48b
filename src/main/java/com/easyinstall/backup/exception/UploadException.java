package com.easyinstall.backup.exception;

import lombok.Getter;

/**
 * A single destination could not be written. Never aborts sibling destinations.
 */
@Getter
public class UploadException extends BackupException {

    private final String provider;

    public UploadException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public UploadException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
