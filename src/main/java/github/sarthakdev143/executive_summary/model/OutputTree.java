package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;

/**
 * Directories a run writes into. {@code imagesDir} is always a direct child of {@code reportDir}, since
 * the report page refers to its images relatively.
 */
public record OutputTree(Path summaryRoot, Path reportDir, Path imagesDir, Path workDir) {

    public static final String REPORT_DIR_NAME = "executivesummary";
    public static final String IMAGES_DIR_NAME = "img";
    public static final String WORK_DIR_NAME = "temp_files";

    public OutputTree {
        if (!imagesDir.getParent().equals(reportDir)) {
            throw new IllegalArgumentException("imagesDir must be a direct child of reportDir.");
        }
    }

    public static OutputTree under(Path summaryRoot) {
        Path reportDir = summaryRoot.resolve(REPORT_DIR_NAME);
        return new OutputTree(
                summaryRoot,
                reportDir,
                reportDir.resolve(IMAGES_DIR_NAME),
                reportDir.resolve(WORK_DIR_NAME));
    }
}
