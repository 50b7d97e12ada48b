package com.easyinstall.backup.client;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.CredentialMissingException;
import com.easyinstall.backup.exception.UploadException;
import com.easyinstall.backup.model.ProviderTag;
import com.easyinstall.backup.utils.AppConstants;
import com.easyinstall.backup.utils.AppUtils;
import com.easyinstall.backup.utils.JPathUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jayway.jsonpath.InvalidJsonException;
import io.micrometer.common.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Uploads to Google Drive through the resumable upload protocol: one request
 * opens an upload session, a second one streams the file into it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleDriveUploadAdapter implements UploadAdapter {

    private final WebClient webClient;
    private final BackupProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public ProviderTag provider() {
        return ProviderTag.GDRIVE;
    }

    @Override
    public String upload(Path file, Map<String, Object> config, Map<String, Object> credentials) {
        if (credentials == null || credentials.isEmpty()) {
            throw new CredentialMissingException(provider().getTag());
        }
        try {
            String accessToken = resolveAccessToken(credentials);
            URI session = openUploadSession(file, AppUtils.getString(config, AppConstants.FOLDER_ID), accessToken);
            String fileId = sendContent(session, file, accessToken);
            if (StringUtils.isBlank(fileId)) {
                throw new UploadException(provider().getTag(), "Drive did not return a file id");
            }
            log.info("Uploaded {} to Google Drive as {}", file, fileId);
            return provider().location(fileId);
        } catch (WebClientException e) {
            throw new UploadException(provider().getTag(), "Google Drive request failed: " + e.getMessage(), e);
        } catch (InvalidJsonException e) {
            throw new UploadException(provider().getTag(), "Google Drive returned an unreadable response", e);
        } catch (UncheckedIOException e) {
            throw new UploadException(provider().getTag(), "Cannot read backup file " + file + ": " + e.getMessage(), e);
        }
    }

    String resolveAccessToken(Map<String, Object> credentials) {
        String refreshToken = AppUtils.getString(credentials, AppConstants.REFRESH_TOKEN);
        String clientId = AppUtils.getString(credentials, AppConstants.CLIENT_ID);
        String clientSecret = AppUtils.getString(credentials, AppConstants.CLIENT_SECRET);

        if (StringUtils.isNotBlank(refreshToken) && StringUtils.isNotBlank(clientId) && StringUtils.isNotBlank(clientSecret)) {
            return refreshAccessToken(credentials, refreshToken, clientId, clientSecret);
        }
        String token = AppUtils.getString(credentials, AppConstants.TOKEN);
        if (StringUtils.isBlank(token)) {
            throw new CredentialMissingException(provider().getTag(), AppConstants.TOKEN);
        }
        return token;
    }

    private String refreshAccessToken(Map<String, Object> credentials, String refreshToken, String clientId, String clientSecret) {
        String tokenUri = AppUtils.getString(credentials, AppConstants.TOKEN_URI, AppConstants.GOOGLE_TOKEN_URI);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add(AppConstants.REFRESH_TOKEN, refreshToken);
        form.add(AppConstants.CLIENT_ID, clientId);
        form.add(AppConstants.CLIENT_SECRET, clientSecret);

        log.debug("Refreshing Google access token via {}", tokenUri);
        String body = webClient.post()
                .uri(tokenUri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .block();
        String accessToken = body == null ? null : JPathUtils.getString(body, "$.access_token");
        if (StringUtils.isBlank(accessToken)) {
            throw new UploadException(provider().getTag(), "Token endpoint returned no access_token");
        }
        return accessToken;
    }

    private URI openUploadSession(Path file, String folderId, String accessToken) {
        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("name", AppUtils.basename(file));
        if (StringUtils.isNotBlank(folderId)) {
            metadata.putArray("parents").add(folderId);
        }

        URI sessionUri = UriComponentsBuilder.fromHttpUrl(properties.getDrive().getUploadUrl())
                .queryParam("uploadType", "resumable")
                .queryParam("fields", "id")
                .build()
                .toUri();

        URI location = webClient.post()
                .uri(sessionUri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .header("X-Upload-Content-Type", MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .header("X-Upload-Content-Length", String.valueOf(sizeOf(file)))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(metadata.toString())
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getHeaders().getLocation())
                .block();
        if (location == null) {
            throw new UploadException(provider().getTag(), "Drive did not open an upload session");
        }
        return location;
    }

    private String sendContent(URI session, Path file, String accessToken) {
        String body = webClient.put()
                .uri(session)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(sizeOf(file))
                .body(BodyInserters.fromResource(new FileSystemResource(file)))
                .retrieve()
                .bodyToMono(String.class)
                .block();
        return body == null ? null : JPathUtils.getString(body, "$.id");
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
