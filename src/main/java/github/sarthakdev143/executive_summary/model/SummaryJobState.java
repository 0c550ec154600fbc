package github.sarthakdev143.executive_summary.model;

public enum SummaryJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED
}
