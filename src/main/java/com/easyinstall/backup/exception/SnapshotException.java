package com.easyinstall.backup.exception;

import lombok.Getter;

/**
 * The snapshot command failed. Aborts the whole backup attempt.
 */
@Getter
public class SnapshotException extends BackupException {

    private final int exitCode;

    public SnapshotException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }
}
