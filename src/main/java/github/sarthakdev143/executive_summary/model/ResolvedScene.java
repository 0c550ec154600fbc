package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Concrete scene text, persisted to a scratch file so the renderer can address its sub-scenes by
 * 1-based ordinal.
 *
 * @param unresolvedPlaceholders placeholders of the template's known tokens still present in {@code text}
 */
public record ResolvedScene(Path sceneFile, String text, List<String> unresolvedPlaceholders) {

    public ResolvedScene {
        unresolvedPlaceholders = unresolvedPlaceholders == null ? List.of() : List.copyOf(unresolvedPlaceholders);
    }
}
