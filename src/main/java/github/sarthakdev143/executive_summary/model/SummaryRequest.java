package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;

/**
 * A validated request for one executive summary run.
 */
public record SummaryRequest(
        Path filesPath,
        String subjectId,
        String sessionId,
        String summaryDir,
        Path funcPath,
        Path atlas,
        boolean layoutOnly,
        boolean skipSprite) {

    public PipelineContext toPipelineContext() {
        return new PipelineContext(filesPath, subjectId, sessionId, atlas, funcPath, skipSprite);
    }
}
