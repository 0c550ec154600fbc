package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;
import java.util.Objects;

public record SceneTemplate(Path source, String text, TokenStyle tokenStyle) {

    public SceneTemplate {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(tokenStyle, "tokenStyle");
    }
}
