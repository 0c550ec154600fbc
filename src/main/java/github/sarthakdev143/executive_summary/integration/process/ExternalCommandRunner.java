package github.sarthakdev143.executive_summary.integration.process;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external imaging binaries synchronously. A call either leaves its expected output in place or
 * fails and leaves nothing at the output path. An interrupted call kills the child process.
 */
@Component
public class ExternalCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExternalCommandRunner.class);

    private final Duration timeout;
    private final int maxAttempts;

    public ExternalCommandRunner(ExecutiveSummaryProperties properties) {
        this.timeout = properties.toolTimeout();
        this.maxAttempts = properties.toolMaxAttempts();
    }

    /**
     * @param command          program and arguments
     * @param stage            short description used in logs and errors
     * @param workingDirectory directory of the child process, or {@code null} to inherit
     * @param expectedOutput   file the command must create, or {@code null} when nothing is checked
     * @return the combined stdout/stderr of the successful attempt
     */
    public String run(List<String> command, String stage, Path workingDirectory, Path expectedOutput)
            throws IOException, InterruptedException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String output = runOnce(command, stage, workingDirectory);
                if (expectedOutput != null && !Files.exists(expectedOutput)) {
                    throw new IOException("Command for stage " + stage + " did not produce " + expectedOutput
                            + ". Output: " + output);
                }
                return output;
            } catch (InterruptedException e) {
                logger.warn("Stage {} was interrupted; removing partial output", stage);
                deleteIfExists(expectedOutput);
                throw e;
            } catch (IOException e) {
                lastFailure = e;
                deleteIfExists(expectedOutput);
                if (attempt < maxAttempts) {
                    logger.warn("Attempt {}/{} failed for stage {}: {}", attempt, maxAttempts, stage, e.getMessage());
                }
            }
        }
        throw lastFailure;
    }

    private String runOnce(List<String> command, String stage, Path workingDirectory)
            throws IOException, InterruptedException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        // Output goes to a file so a tool that never closes its streams still hits the timeout.
        Path log = Files.createTempFile("executive-summary-tool-", ".log");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(log.toFile());
            if (workingDirectory != null) {
                processBuilder.directory(workingDirectory.toFile());
            }
            Process process = processBuilder.start();

            try {
                if (timeout == null) {
                    process.waitFor();
                } else {
                    boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (!finished) {
                        process.destroyForcibly();
                        throw new IOException("Command timed out during stage: " + stage);
                    }
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException(
                        "Command failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + output);
            }
            return output;
        } finally {
            Files.deleteIfExists(log);
        }
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove partial output {}", path, e);
        }
    }
}
