package com.easyinstall.backup.exception;

public class ResourceNotFoundException extends BackupException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
