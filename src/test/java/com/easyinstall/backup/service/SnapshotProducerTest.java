package com.easyinstall.backup.service;

import com.easyinstall.backup.SteppingClock;
import com.easyinstall.backup.client.CommandRunner;
import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.exception.SnapshotException;
import com.easyinstall.backup.model.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SnapshotProducer Tests")
class SnapshotProducerTest {

    @Mock
    private CommandRunner commandRunner;

    @TempDir
    Path tempDir;

    private SnapshotProducer snapshotProducer;

    @BeforeEach
    void setUp() {
        BackupProperties properties = new BackupProperties();
        properties.setTempDir(tempDir.resolve("work").toString());
        snapshotProducer = new SnapshotProducer(commandRunner, properties,
                new SteppingClock(Instant.parse("2024-03-05T08:09:10Z"), Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("Should build timestamp qualified artifact names that differ between calls")
    void should_GenerateDistinctPaths_When_CalledTwice() {
        // When
        Path first = snapshotProducer.nextArtifactPath();
        Path second = snapshotProducer.nextArtifactPath();

        // Then
        assertEquals("backup-20240305-080910.tar.gz", first.getFileName().toString());
        assertEquals("backup-20240305-080911.tar.gz", second.getFileName().toString());
        assertEquals(first.getParent(), second.getParent());
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Should append the artifact path to the snapshot command")
    void should_RunSnapshotCommand_When_Producing() throws Exception {
        // Given
        Path artifact = snapshotProducer.nextArtifactPath();
        when(commandRunner.run(anyList())).thenAnswer(invocation -> {
            Files.writeString(artifact, "archive");
            return new CommandResult(0, "done", "");
        });

        // When
        Path produced = snapshotProducer.produce(artifact);

        // Then
        assertEquals(artifact, produced);
        assertTrue(Files.isDirectory(artifact.getParent()));
        verify(commandRunner).run(List.of("easyinstall", "backup", "--output", artifact.toString()));
    }

    @Test
    @DisplayName("Should raise SnapshotException when the command exits nonzero")
    void should_ThrowSnapshotException_When_CommandFails() {
        // Given
        Path artifact = snapshotProducer.nextArtifactPath();
        when(commandRunner.run(anyList())).thenReturn(new CommandResult(3, "", "disk full"));

        // When & Then
        SnapshotException exception = assertThrows(SnapshotException.class, () -> snapshotProducer.produce(artifact));
        assertEquals(3, exception.getExitCode());
        assertTrue(exception.getMessage().contains("disk full"));
    }

    @Test
    @DisplayName("Should raise SnapshotException when the command leaves no file behind")
    void should_ThrowSnapshotException_When_NoArtifactWritten() {
        // Given
        Path artifact = snapshotProducer.nextArtifactPath();
        when(commandRunner.run(anyList())).thenReturn(new CommandResult(0, "", ""));

        // When & Then
        assertThrows(SnapshotException.class, () -> snapshotProducer.produce(artifact));
    }
}
