package github.sarthakdev143.executive_summary.integration.workbench;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import github.sarthakdev143.executive_summary.integration.process.ExternalCommandRunner;
import github.sarthakdev143.executive_summary.service.SceneRenderer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders scenes with Connectome Workbench ({@code wb_command -show-scene}).
 */
@Component
public class WorkbenchSceneRenderer implements SceneRenderer {

    private final ExternalCommandRunner commandRunner;
    private final String wbCommand;

    public WorkbenchSceneRenderer(ExternalCommandRunner commandRunner, ExecutiveSummaryProperties properties) {
        this.commandRunner = commandRunner;
        this.wbCommand = properties.tools().wbCommand();
    }

    @Override
    public void renderScene(Path sceneFile, String sceneNameOrNumber, Path outputImage, int width, int height)
            throws IOException, InterruptedException {
        List<String> command = buildShowSceneCommand(sceneFile, sceneNameOrNumber, outputImage, width, height);
        commandRunner.run(command, "show scene " + sceneNameOrNumber + " of " + sceneFile.getFileName(), null, outputImage);
    }

    List<String> buildShowSceneCommand(Path sceneFile, String sceneNameOrNumber, Path outputImage, int width, int height) {
        return List.of(
                wbCommand,
                "-show-scene",
                sceneFile.toString(),
                sceneNameOrNumber,
                outputImage.toString(),
                String.valueOf(width),
                String.valueOf(height));
    }
}
