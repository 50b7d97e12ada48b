package com.easyinstall.backup.exception;

import lombok.Getter;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Persistent store failure. Duplicate keys are rejected, never retried.
 */
@Getter
public class StoreException extends BackupException {

    private final boolean duplicate;

    public StoreException(String message, DataAccessException cause) {
        super(message, cause);
        this.duplicate = cause instanceof DataIntegrityViolationException;
    }
}
