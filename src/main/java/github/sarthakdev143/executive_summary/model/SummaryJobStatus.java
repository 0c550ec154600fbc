package github.sarthakdev143.executive_summary.model;

import java.time.Instant;
import java.util.List;

public record SummaryJobStatus(
        String jobId,
        SummaryJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String subjectId,
        String sessionId,
        boolean layoutOnly,
        String reportDirectory,
        List<String> artifacts,
        List<String> skipped,
        List<String> failures) {

    public SummaryJobStatus {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
