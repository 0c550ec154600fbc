package github.sarthakdev143.executive_summary.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders one scene of a scene file to an image.
 */
public interface SceneRenderer {

    void renderScene(Path sceneFile, String sceneNameOrNumber, Path outputImage, int width, int height)
            throws IOException, InterruptedException;

    default void renderScene(Path sceneFile, int sceneOrdinal, Path outputImage, int width, int height)
            throws IOException, InterruptedException {
        if (sceneOrdinal < 1) {
            throw new IllegalArgumentException("Scene ordinals start at 1, got " + sceneOrdinal + ".");
        }
        renderScene(sceneFile, String.valueOf(sceneOrdinal), outputImage, width, height);
    }
}
