package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import github.sarthakdev143.executive_summary.model.OutputTree;
import github.sarthakdev143.executive_summary.model.SummaryJobState;
import github.sarthakdev143.executive_summary.model.SummaryJobStatus;
import github.sarthakdev143.executive_summary.model.SummaryRequest;
import github.sarthakdev143.executive_summary.model.SummaryRunReport;
import github.sarthakdev143.executive_summary.service.SummaryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultSummaryService implements SummaryService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSummaryService.class);

    private final OutputTreeManager outputTreeManager;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final TaskExecutor taskExecutor;
    private final boolean keepWorkDir;
    private final Map<String, SummaryJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter layoutOnlyJobsCounter;
    private final Counter jobFailureCounter;

    public DefaultSummaryService(
            OutputTreeManager outputTreeManager,
            PipelineOrchestrator pipelineOrchestrator,
            TaskExecutor taskExecutor,
            ExecutiveSummaryProperties properties,
            MeterRegistry meterRegistry) {
        this.outputTreeManager = outputTreeManager;
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.taskExecutor = taskExecutor;
        this.keepWorkDir = properties.keepWorkDir();
        this.layoutOnlyJobsCounter = meterRegistry.counter("executive_summary.jobs.layout_only");
        this.jobFailureCounter = meterRegistry.counter("executive_summary.jobs.failures");
    }

    @Override
    public String submitJob(SummaryRequest request) {
        String jobId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        jobs.put(jobId, new SummaryJobStatus(
                jobId,
                SummaryJobState.QUEUED,
                "Job queued.",
                now,
                now,
                request.subjectId(),
                request.sessionId(),
                request.layoutOnly(),
                null,
                List.of(),
                List.of(),
                List.of()));

        if (request.layoutOnly()) {
            layoutOnlyJobsCounter.increment();
        }

        logger.info(
                "Accepted summary job {} subject={} session={} layoutOnly={} skipSprite={}",
                jobId,
                request.subjectId(),
                request.sessionId(),
                request.layoutOnly(),
                request.skipSprite());

        taskExecutor.execute(() -> processJob(jobId, request));
        return jobId;
    }

    @Override
    public Optional<SummaryJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void processJob(String jobId, SummaryRequest request) {
        updateJobState(jobId, SummaryJobState.PROCESSING, "Preparing report directory.");

        Optional<OutputTree> preparedTree = outputTreeManager.prepare(
                request.filesPath(),
                request.summaryDir(),
                request.layoutOnly());
        if (preparedTree.isEmpty()) {
            jobFailureCounter.increment();
            markJobFailed(jobId, "Summary directory is missing or not writable under " + request.filesPath() + ".");
            return;
        }

        OutputTree tree = preparedTree.get();
        if (request.layoutOnly()) {
            logger.info("Layout-only job {}: keeping existing images in {}", jobId, tree.imagesDir());
            markJobCompleted(jobId, tree, SummaryRunReport.empty(), "Report directory ready; images were not regenerated.");
            return;
        }

        updateJobState(jobId, SummaryJobState.PROCESSING, "Generating images.");
        try {
            SummaryRunReport report = pipelineOrchestrator.run(request.toPipelineContext(), tree);
            String message = report.hasFailures()
                    ? "Images generated with failures."
                    : "Images generated successfully.";
            markJobCompleted(jobId, tree, report, message);
            logger.info(
                    "Completed summary job {} produced={} skipped={} failed={}",
                    jobId,
                    report.producedArtifacts().size(),
                    report.skipped().size(),
                    report.failures().size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobFailureCounter.increment();
            logger.error("Summary job {} was interrupted", jobId, e);
            markJobFailed(jobId, "Image generation was interrupted.");
        } catch (Exception e) {
            jobFailureCounter.increment();
            logger.error("Summary job {} failed", jobId, e);
            markJobFailed(jobId, "Image generation failed. Check server logs.");
        } finally {
            if (!keepWorkDir) {
                outputTreeManager.discardWorkDir(tree);
            }
        }
    }

    private void updateJobState(String jobId, SummaryJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new SummaryJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.subjectId(),
                current.sessionId(),
                current.layoutOnly(),
                current.reportDirectory(),
                current.artifacts(),
                current.skipped(),
                current.failures()));
    }

    private void markJobCompleted(String jobId, OutputTree tree, SummaryRunReport report, String message) {
        List<String> artifacts = report.producedArtifacts()
                .stream()
                .map(artifact -> relativeToReport(tree, artifact))
                .toList();

        jobs.computeIfPresent(jobId, (ignored, current) -> new SummaryJobStatus(
                current.jobId(),
                SummaryJobState.COMPLETED,
                message,
                current.createdAt(),
                Instant.now(),
                current.subjectId(),
                current.sessionId(),
                current.layoutOnly(),
                tree.reportDir().toString(),
                artifacts,
                report.skipped(),
                report.failures()));
    }

    private void markJobFailed(String jobId, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new SummaryJobStatus(
                current.jobId(),
                SummaryJobState.FAILED,
                message,
                current.createdAt(),
                Instant.now(),
                current.subjectId(),
                current.sessionId(),
                current.layoutOnly(),
                current.reportDirectory(),
                current.artifacts(),
                current.skipped(),
                current.failures()));
    }

    private String relativeToReport(OutputTree tree, Path artifact) {
        return artifact.startsWith(tree.reportDir())
                ? tree.reportDir().relativize(artifact).toString()
                : artifact.toString();
    }
}
