package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of one subject run. Immutable for the duration of the run; together with what exists on disk
 * they decide which images are produced.
 *
 * @param filesPath  derivatives root of the subject
 * @param subjectId  participant label without the {@code sub-} prefix
 * @param sessionId  session label without the {@code ses-} prefix, or {@code null}
 * @param atlas      explicit atlas volume, or {@code null} for the configured default
 * @param funcPath   BIDS functional directory, or {@code null}
 * @param skipSprite whether brainsprite frames are skipped
 */
public record PipelineContext(
        Path filesPath,
        String subjectId,
        String sessionId,
        Path atlas,
        Path funcPath,
        boolean skipSprite) {

    public PipelineContext {
        Objects.requireNonNull(filesPath, "filesPath");
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId is required.");
        }
        sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId;
    }

    public String imagesPrefix() {
        String prefix = "sub-" + subjectId;
        if (sessionId != null) {
            prefix += "_ses-" + sessionId;
        }
        return prefix;
    }

    public String taskPrefix(String taskName) {
        return "sub-" + subjectId + "_" + taskName;
    }
}
