package com.easyinstall.backup.client;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.UploadException;
import com.easyinstall.backup.model.CommandResult;
import com.easyinstall.backup.model.ProviderTag;
import com.easyinstall.backup.utils.AppConstants;
import com.easyinstall.backup.utils.AppUtils;
import io.micrometer.common.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Delegates the transfer to the rclone binary. Remote definitions live in
 * rclone's own config, so stored credentials are not consulted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RcloneUploadAdapter implements UploadAdapter {

    private final CommandRunner commandRunner;
    private final BackupProperties properties;

    @Override
    public ProviderTag provider() {
        return ProviderTag.RCLONE;
    }

    @Override
    public String upload(Path file, Map<String, Object> config, Map<String, Object> credentials) {
        String remote = AppUtils.getString(config, AppConstants.REMOTE);
        String remotePath = AppUtils.getString(config, AppConstants.PATH);
        if (StringUtils.isBlank(remote) || remotePath == null) {
            throw new UploadException(provider().getTag(), "rclone destination needs remote and path");
        }
        String target = remote + ":" + remotePath;

        CommandResult result = commandRunner.run(List.of(properties.getRcloneBinary(), "copy", file.toString(), target));
        if (!result.isSuccess()) {
            throw new UploadException(provider().getTag(), "Rclone failed: " + result.getStderr());
        }
        return provider().location(target + "/" + AppUtils.basename(file));
    }
}
