package com.easyinstall.backup.client;

import com.easyinstall.backup.config.BackupProperties;
import com.easyinstall.backup.model.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command to completion and captures its exit code and output.
 * Each process gets its own pair of drain threads, so concurrent commands never
 * wait on each other's pipes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

    static final int EXIT_NOT_FOUND = 127;
    static final int EXIT_INTERRUPTED = 130;
    static final int EXIT_TIMED_OUT = 124;

    private static final long DRAIN_JOIN_MILLIS = 5000;

    private final BackupProperties properties;

    public CommandResult run(List<String> command) {
        log.info("Running command: {}", String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            log.error("Unable to start command {}", command.get(0), e);
            return new CommandResult(EXIT_NOT_FOUND, "", e.getMessage());
        }

        String name = command.get(0);
        StreamDrain stdout = StreamDrain.start(process.getInputStream(), name + "-stdout");
        StreamDrain stderr = StreamDrain.start(process.getErrorStream(), name + "-stderr");
        try {
            int exitCode;
            Duration timeout = properties.getCommandTimeout();
            if (timeout != null && !timeout.isZero()) {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Command {} exceeded {} and was destroyed", name, timeout);
                    process.destroyForcibly();
                    return new CommandResult(EXIT_TIMED_OUT, stdout.await(DRAIN_JOIN_MILLIS), "timed out after " + timeout);
                }
                exitCode = process.exitValue();
            } else {
                exitCode = process.waitFor();
            }
            CommandResult result = new CommandResult(exitCode, stdout.await(DRAIN_JOIN_MILLIS), stderr.await(DRAIN_JOIN_MILLIS));
            log.info("Command {} exited with {}", name, exitCode);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(EXIT_INTERRUPTED, "", "interrupted");
        }
    }

    /**
     * Copies one process stream into memory on a dedicated daemon thread.
     */
    private static final class StreamDrain implements Runnable {

        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;

        private StreamDrain(InputStream stream, String threadName) {
            this.stream = stream;
            this.thread = new Thread(this, threadName);
            this.thread.setDaemon(true);
        }

        static StreamDrain start(InputStream stream, String threadName) {
            StreamDrain drain = new StreamDrain(stream, threadName);
            drain.thread.start();
            return drain;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream in = stream) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                log.warn("Stream {} closed while draining: {}", thread.getName(), e.getMessage());
            }
        }

        String await(long millis) throws InterruptedException {
            thread.join(millis);
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
