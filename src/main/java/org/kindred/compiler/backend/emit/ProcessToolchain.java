package org.kindred.compiler.backend.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the toolchain as an operating system process. Standard output is discarded; the error
 * stream is drained on a separate thread so that a chatty process cannot block on a full pipe.
 */
public class ProcessToolchain implements Toolchain {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessToolchain.class);
    private static final long READER_JOIN_MILLIS = 1000;

    @Override
    public ToolchainResult run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        LOG.debug("Running toolchain: {}", String.join(" ", command));

        Process process = pb.start();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread errorReader = new Thread(() -> {
            try (InputStream stream = process.getErrorStream()) {
                stream.transferTo(stderr);
            } catch (IOException e) {
                LOG.debug("Stopped reading toolchain error stream: {}", e.getMessage());
            }
        }, "toolchain-stderr");
        errorReader.setDaemon(true);
        errorReader.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            process.waitFor();
            errorReader.join(READER_JOIN_MILLIS);
            LOG.warn("Toolchain did not finish within {}", timeout);
            return ToolchainResult.timeout(captured(stderr));
        }
        errorReader.join(READER_JOIN_MILLIS);
        return ToolchainResult.finished(process.exitValue(), captured(stderr));
    }

    private static String captured(ByteArrayOutputStream stderr) {
        synchronized (stderr) {
            return stderr.toString(StandardCharsets.UTF_8);
        }
    }
}
