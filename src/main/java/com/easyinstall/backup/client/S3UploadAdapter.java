package com.easyinstall.backup.client;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.CredentialMissingException;
import com.easyinstall.backup.exception.UploadException;
import com.easyinstall.backup.model.ProviderTag;
import com.easyinstall.backup.utils.AppConstants;
import com.easyinstall.backup.utils.AppUtils;
import io.micrometer.common.util.StringUtils;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

@Slf4j
@Component
public class S3UploadAdapter implements UploadAdapter {

    private final BackupProperties properties;
    private final Function<S3Settings, S3Client> clientFactory;

    @Autowired
    public S3UploadAdapter(BackupProperties properties) {
        this(properties, S3UploadAdapter::buildClient);
    }

    S3UploadAdapter(BackupProperties properties, Function<S3Settings, S3Client> clientFactory) {
        this.properties = properties;
        this.clientFactory = clientFactory;
    }

    @Override
    public ProviderTag provider() {
        return ProviderTag.S3;
    }

    @Override
    public String upload(Path file, Map<String, Object> config, Map<String, Object> credentials) {
        if (credentials == null || credentials.isEmpty()) {
            throw new CredentialMissingException(provider().getTag());
        }
        String accessKey = require(credentials, AppConstants.ACCESS_KEY);
        String secretKey = require(credentials, AppConstants.SECRET_KEY);
        String region = AppUtils.getString(credentials, AppConstants.REGION, properties.getDefaultRegion());

        String bucket = AppUtils.getString(config, AppConstants.BUCKET);
        if (StringUtils.isBlank(bucket)) {
            throw new UploadException(provider().getTag(), "s3 destination has no bucket");
        }
        String prefix = AppUtils.getString(config, AppConstants.PREFIX, "");
        String key = prefix + "/" + AppUtils.basename(file);

        log.info("Uploading {} to s3 bucket {} as {}", file, bucket, key);
        try (S3Client s3 = clientFactory.apply(new S3Settings(accessKey, secretKey, region))) {
            PutObjectRequest putRequest = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();
            s3.putObject(putRequest, RequestBody.fromFile(file));
        } catch (SdkException e) {
            throw new UploadException(provider().getTag(), "Failed to upload backup to S3: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new UploadException(provider().getTag(), "Cannot read backup file " + file + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new UploadException(provider().getTag(), "Invalid S3 settings: " + e.getMessage(), e);
        }
        return provider().location(bucket + "/" + key);
    }

    private String require(Map<String, Object> credentials, String key) {
        String value = AppUtils.getString(credentials, key);
        if (StringUtils.isBlank(value)) {
            throw new CredentialMissingException(provider().getTag(), key);
        }
        return value;
    }

    static S3Client buildClient(S3Settings settings) {
        return S3Client.builder()
                .region(Region.of(settings.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(settings.getAccessKey(), settings.getSecretKey())))
                .build();
    }

    @Value
    static class S3Settings {
        String accessKey;
        String secretKey;
        String region;
    }
}
