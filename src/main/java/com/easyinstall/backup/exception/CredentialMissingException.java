package com.easyinstall.backup.exception;

public class CredentialMissingException extends UploadException {

    public CredentialMissingException(String provider) {
        super(provider, provider + " credentials not configured");
    }

    public CredentialMissingException(String provider, String missingKey) {
        super(provider, provider + " credentials missing '" + missingKey + "'");
    }
}
