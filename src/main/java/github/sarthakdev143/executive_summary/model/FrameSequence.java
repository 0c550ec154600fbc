package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;
import java.util.List;

public record FrameSequence(Contrast contrast, Path directory, List<Path> frames) {

    public FrameSequence {
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }
}
