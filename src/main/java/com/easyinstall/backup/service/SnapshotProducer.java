package com.easyinstall.backup.service;

import com.easyinstall.backup.client.CommandRunner;
import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.SnapshotException;
import com.easyinstall.backup.model.CommandResult;
import com.easyinstall.backup.utils.AppUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces the local backup artifact by invoking the hosting CLI.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotProducer {

    private final CommandRunner commandRunner;
    private final BackupProperties properties;
    private final Clock clock;

    public Path nextArtifactPath() {
        return AppUtils.artifactPath(Paths.get(properties.getTempDir()), clock);
    }

    public Path produce(Path artifact) {
        ensureDirectory(artifact.getParent());

        List<String> command = new ArrayList<>(properties.getSnapshotCommand());
        command.add(artifact.toString());

        log.info("Creating snapshot {}", artifact);
        CommandResult result = commandRunner.run(command);
        if (!result.isSuccess()) {
            throw new SnapshotException("Snapshot command exited with " + result.getExitCode() + ": " + result.getStderr(),
                    result.getExitCode());
        }
        if (!Files.isRegularFile(artifact)) {
            throw new SnapshotException("Snapshot command produced no file at " + artifact, result.getExitCode());
        }
        return artifact;
    }

    private void ensureDirectory(Path dir) {
        if (dir == null) {
            return;
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create artifact directory: " + dir, e);
        }
    }
}
