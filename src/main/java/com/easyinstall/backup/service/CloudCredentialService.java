package com.easyinstall.backup.service;

import com.easyinstall.backup.dao.CloudCredentialDaoService;
import com.easyinstall.backup.model.CredentialRecord;
import com.easyinstall.backup.model.ProviderTag;
import com.easyinstall.backup.utils.AppConstants;
import com.easyinstall.backup.utils.AppUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential store facade. The default flag is cleared for every provider of
 * the owner when a new default is saved, while lookups stay per provider.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CloudCredentialService {

    private final CloudCredentialDaoService credentialDaoService;
    private final BackupValidationService validationService;

    public Optional<Map<String, Object>> getCredentials(Long ownerId, String provider) {
        return credentialDaoService.find(ownerId, provider).map(CredentialRecord::getCredentials);
    }

    /**
     * Returns the owner's default record, whichever provider it belongs to.
     */
    public Optional<Map<String, Object>> getDefaultCredentials(Long ownerId) {
        return credentialDaoService.findDefault(ownerId).map(CredentialRecord::getCredentials);
    }

    public void saveCredentials(Long ownerId, String provider, Map<String, Object> credentials, String name, boolean makeDefault) {
        credentialDaoService.save(ownerId, provider, credentials, name, makeDefault);
    }

    /**
     * Builds the provider specific credential map from a configure request and stores it.
     */
    public void configure(Long ownerId, String provider, Map<String, Object> request) {
        ProviderTag tag = ProviderTag.fromTag(provider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider"));
        Map<String, Object> data = request == null ? Map.of() : request;

        Map<String, Object> credentials = new LinkedHashMap<>();
        if (tag == ProviderTag.S3) {
            validationService.validateParam(data, AppConstants.ACCESS_KEY, "access_key");
            validationService.validateParam(data, AppConstants.SECRET_KEY, "secret_key");
            credentials.put(AppConstants.ACCESS_KEY, data.get(AppConstants.ACCESS_KEY));
            credentials.put(AppConstants.SECRET_KEY, data.get(AppConstants.SECRET_KEY));
            credentials.put(AppConstants.REGION, AppUtils.getString(data, AppConstants.REGION, "us-east-1"));
        } else if (tag == ProviderTag.GDRIVE) {
            validationService.validateParam(data, AppConstants.TOKEN, "token");
            validationService.validateParam(data, AppConstants.CLIENT_ID, "client_id");
            validationService.validateParam(data, AppConstants.CLIENT_SECRET, "client_secret");
            credentials.put(AppConstants.TOKEN, data.get(AppConstants.TOKEN));
            credentials.put(AppConstants.REFRESH_TOKEN, data.get(AppConstants.REFRESH_TOKEN));
            credentials.put(AppConstants.TOKEN_URI, AppConstants.GOOGLE_TOKEN_URI);
            credentials.put(AppConstants.CLIENT_ID, data.get(AppConstants.CLIENT_ID));
            credentials.put(AppConstants.CLIENT_SECRET, data.get(AppConstants.CLIENT_SECRET));
            credentials.put(AppConstants.SCOPES, List.of(AppConstants.DRIVE_FILE_SCOPE));
        } else {
            validationService.validateParam(data, AppConstants.REMOTE, "remote");
            credentials.put(AppConstants.REMOTE, data.get(AppConstants.REMOTE));
            credentials.put(AppConstants.TYPE, AppUtils.getString(data, AppConstants.TYPE, AppConstants.DEFAULT_RCLONE_TYPE));
        }

        boolean makeDefault = Boolean.TRUE.equals(data.get(AppConstants.DEFAULT));
        saveCredentials(ownerId, tag.getTag(), credentials, AppUtils.getString(data, AppConstants.NAME), makeDefault);
    }

    public Map<String, Map<String, Boolean>> status(Long ownerId) {
        Optional<Map<String, Object>> defaultCredentials = getDefaultCredentials(ownerId);
        Map<String, Map<String, Boolean>> status = new LinkedHashMap<>();
        for (ProviderTag tag : ProviderTag.values()) {
            Optional<Map<String, Object>> credentials = getCredentials(ownerId, tag.getTag());
            boolean isDefault = credentials.isPresent()
                    && defaultCredentials.isPresent()
                    && Objects.equals(credentials.get(), defaultCredentials.get());
            Map<String, Boolean> providerStatus = new LinkedHashMap<>();
            providerStatus.put("configured", credentials.isPresent());
            providerStatus.put("default", isDefault);
            status.put(tag.getTag(), providerStatus);
        }
        return status;
    }
}
