package github.sarthakdev143.executive_summary.dto;

public record SummaryJobRequest(
        String filesPath,
        String subjectId,
        String sessionId,
        String summaryDir,
        String funcPath,
        String atlas,
        Boolean layoutOnly,
        Boolean skipSprite) {
}
