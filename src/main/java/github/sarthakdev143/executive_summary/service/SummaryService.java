package github.sarthakdev143.executive_summary.service;

import github.sarthakdev143.executive_summary.model.SummaryJobStatus;
import github.sarthakdev143.executive_summary.model.SummaryRequest;

import java.util.Optional;

public interface SummaryService {

    String submitJob(SummaryRequest request);

    Optional<SummaryJobStatus> getJobStatus(String jobId);
}
