package com.easyinstall.backup.client;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.UploadException;
import com.easyinstall.backup.model.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RcloneUploadAdapter Tests")
class RcloneUploadAdapterTest {

    private static final Path ARTIFACT = Path.of("/tmp/easyinstall-webui/backup-20240305-080910.tar.gz");

    @Mock
    private CommandRunner commandRunner;

    private RcloneUploadAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new RcloneUploadAdapter(commandRunner, new BackupProperties());
    }

    @Test
    @DisplayName("Should copy to remote:path and return an rclone location")
    void should_RunRcloneCopy_When_DestinationComplete() {
        // Given
        List<String> expected = List.of("rclone", "copy", ARTIFACT.toString(), "box:backups/site");
        when(commandRunner.run(expected)).thenReturn(new CommandResult(0, "", ""));

        // When
        String location = adapter.upload(ARTIFACT, Map.of("remote", "box", "path", "backups/site"), null);

        // Then
        assertEquals("rclone://box:backups/site/backup-20240305-080910.tar.gz", location);
    }

    @Test
    @DisplayName("Should surface rclone stderr when the copy fails")
    void should_ThrowUploadException_When_ExitNonZero() {
        // Given
        when(commandRunner.run(any())).thenReturn(new CommandResult(1, "", "didn't find section in config file"));

        // When
        UploadException e = assertThrows(UploadException.class,
                () -> adapter.upload(ARTIFACT, Map.of("remote", "nope", "path", "x"), null));

        // Then
        assertTrue(e.getMessage().startsWith("Rclone failed: "));
        assertTrue(e.getMessage().contains("didn't find section"));
    }

    @Test
    @DisplayName("Should not run rclone when remote is missing")
    void should_Reject_When_RemoteMissing() {
        assertThrows(UploadException.class, () -> adapter.upload(ARTIFACT, Map.of("path", "x"), null));
        verify(commandRunner, never()).run(any());
    }
}
