package github.sarthakdev143.executive_summary.controller;

import github.sarthakdev143.executive_summary.dto.SummaryJobRequest;
import github.sarthakdev143.executive_summary.dto.SummaryJobSubmissionResponse;
import github.sarthakdev143.executive_summary.model.SummaryJobState;
import github.sarthakdev143.executive_summary.model.SummaryRequest;
import github.sarthakdev143.executive_summary.service.SummaryService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

@RestController
@RequestMapping("/api/summary")
public class SummaryController {

    private static final Logger logger = LoggerFactory.getLogger(SummaryController.class);
    private static final String NOT_SUPPLIED = "NONE";

    private final SummaryService summaryService;

    public SummaryController(SummaryService summaryService) {
        this.summaryService = summaryService;
    }

    @PostMapping(value = "/jobs", consumes = "application/json")
    public ResponseEntity<?> submit(@RequestBody SummaryJobRequest body) {
        try {
            SummaryRequest request = validate(body);
            String jobId = summaryService.submitJob(request);
            return ResponseEntity.accepted()
                    .body(new SummaryJobSubmissionResponse(
                            jobId,
                            SummaryJobState.QUEUED,
                            "Summary job accepted. Poll /api/summary/jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Summary job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit summary job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return summaryService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    private SummaryRequest validate(SummaryJobRequest body) {
        if (body == null) {
            throw new IllegalArgumentException("Request body is required.");
        }

        String filesPathInput = optional(body.filesPath());
        if (filesPathInput == null) {
            throw new IllegalArgumentException("filesPath is required.");
        }
        Path filesPath = toPath("filesPath", filesPathInput);
        if (!Files.isDirectory(filesPath)) {
            throw new IllegalArgumentException("Directory does not exist: " + filesPath);
        }

        String subjectId = optional(body.subjectId());
        if (subjectId == null) {
            throw new IllegalArgumentException("subjectId is required.");
        }
        if (subjectId.startsWith("sub-")) {
            throw new IllegalArgumentException("subjectId must not include the sub- prefix.");
        }

        String sessionId = optional(body.sessionId());
        if (sessionId != null && sessionId.startsWith("ses-")) {
            throw new IllegalArgumentException("sessionId must not include the ses- prefix.");
        }

        Path atlas = null;
        String atlasInput = optional(body.atlas());
        if (atlasInput != null) {
            atlas = toPath("atlas", atlasInput);
            if (!Files.isRegularFile(atlas)) {
                throw new IllegalArgumentException("Atlas file does not exist: " + atlas);
            }
        }

        String funcPathInput = optional(body.funcPath());
        Path funcPath = funcPathInput == null ? null : toPath("funcPath", funcPathInput);

        return new SummaryRequest(
                filesPath,
                subjectId,
                sessionId,
                optional(body.summaryDir()),
                funcPath,
                atlas,
                Boolean.TRUE.equals(body.layoutOnly()),
                Boolean.TRUE.equals(body.skipSprite()));
    }

    // Blank values and the literal NONE mean the option was not given.
    private String optional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return NOT_SUPPLIED.equals(trimmed.toUpperCase(Locale.ROOT)) ? null : trimmed;
    }

    // Absolute, so scene files written elsewhere still point at the inputs.
    private Path toPath(String fieldName, String value) {
        try {
            return Path.of(value).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException(fieldName + " is not a valid path.", e);
        }
    }
}
