package com.easyinstall.backup.client;

import com.easyinstall.backup.model.ProviderTag;

import java.nio.file.Path;
import java.util.Map;

/**
 * Uploads one local file to one provider.
 */
public interface UploadAdapter {

    ProviderTag provider();

    /**
     * @param file        the artifact to upload
     * @param config      provider specific destination settings taken from the job
     * @param credentials the owner's stored credentials for this provider, or {@code null}
     * @return a location URI whose scheme is this adapter's provider tag
     * @throws com.easyinstall.backup.exception.UploadException on any transport, auth or API failure
     */
    String upload(Path file, Map<String, Object> config, Map<String, Object> credentials);
}
