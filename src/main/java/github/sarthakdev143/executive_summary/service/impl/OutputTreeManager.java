package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.model.OutputTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Creates the report directory tree of a run.
 *
 * <p>Outside layout-only mode an existing report directory is discarded and recreated, so images of a
 * previous run never mix with the new ones. In layout-only mode nothing is deleted and only missing
 * directories are created.
 */
@Component
public class OutputTreeManager {

    private static final Logger logger = LoggerFactory.getLogger(OutputTreeManager.class);

    /**
     * @param filesPath  derivatives root of the subject
     * @param summaryDir optional summary subdirectory, relative to {@code filesPath}
     * @param layoutOnly keep what is already on disk
     * @return the prepared tree, or empty when the summary root does not exist or cannot be written
     */
    public Optional<OutputTree> prepare(Path filesPath, String summaryDir, boolean layoutOnly) {
        Path summaryRoot = summaryDir == null || summaryDir.isBlank()
                ? filesPath
                : filesPath.resolve(summaryDir);

        if (!Files.isDirectory(summaryRoot)) {
            logger.error("Directory does not exist: {}", summaryRoot);
            return Optional.empty();
        }

        OutputTree tree = OutputTree.under(summaryRoot);
        try {
            if (!layoutOnly && Files.exists(tree.reportDir())) {
                logger.info("Removing report directory of a prior run: {}", tree.reportDir());
                deleteRecursively(tree.reportDir());
            }
            Files.createDirectories(tree.reportDir());
            Files.createDirectories(tree.imagesDir());
            Files.createDirectories(tree.workDir());
        } catch (IOException e) {
            logger.error("Cannot prepare report directory {}", tree.reportDir(), e);
            return Optional.empty();
        }

        return Optional.of(tree);
    }

    /**
     * Removes the working directory of a finished run. Failures are logged only.
     */
    public void discardWorkDir(OutputTree tree) {
        try {
            deleteRecursively(tree.workDir());
        } catch (IOException e) {
            logger.warn("Could not remove working directory {}", tree.workDir(), e);
        }
    }

    static void deleteRecursively(Path directory) throws IOException {
        if (Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
