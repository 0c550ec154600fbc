package github.sarthakdev143.executive_summary.dto;

import github.sarthakdev143.executive_summary.model.SummaryJobState;

public record SummaryJobSubmissionResponse(
        String jobId,
        SummaryJobState state,
        String message) {
}
