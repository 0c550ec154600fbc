package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a pipeline run: what was written, what was left out because an input was missing, and
 * what an external tool failed to produce.
 */
public record SummaryRunReport(
        List<Path> producedArtifacts,
        List<String> skipped,
        List<String> failures) {

    public SummaryRunReport {
        producedArtifacts = producedArtifacts == null ? List.of() : List.copyOf(producedArtifacts);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static SummaryRunReport empty() {
        return new SummaryRunReport(List.of(), List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
