package github.sarthakdev143.executive_summary.integration.fsl;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import github.sarthakdev143.executive_summary.integration.process.ExternalCommandRunner;
import github.sarthakdev143.executive_summary.service.VolumeProcessor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resampling with {@code flirt} and binarization with {@code fslmaths}.
 */
@Component
public class FslVolumeProcessor implements VolumeProcessor {

    private final ExternalCommandRunner commandRunner;
    private final ExecutiveSummaryProperties.Tools tools;

    public FslVolumeProcessor(ExternalCommandRunner commandRunner, ExecutiveSummaryProperties properties) {
        this.commandRunner = commandRunner;
        this.tools = properties.tools();
    }

    @Override
    public void resample(Path moving, Path reference, boolean applyExistingTransform, Path output)
            throws IOException, InterruptedException {
        commandRunner.run(
                buildResampleCommand(moving, reference, applyExistingTransform, output),
                "resample " + moving.getFileName() + " to " + reference.getFileName(),
                null,
                output);
    }

    @Override
    public void binarize(Path input, Path output) throws IOException, InterruptedException {
        commandRunner.run(buildBinarizeCommand(input, output), "binarize " + input.getFileName(), null, output);
    }

    List<String> buildResampleCommand(Path moving, Path reference, boolean applyExistingTransform, Path output) {
        List<String> command = new ArrayList<>();
        command.add(tools.flirt());
        command.add("-in");
        command.add(moving.toString());
        command.add("-ref");
        command.add(reference.toString());
        command.add("-out");
        command.add(output.toString());
        if (applyExistingTransform) {
            // Without -init flirt applies the identity matrix, i.e. a plain resample.
            command.add("-applyxfm");
        }
        return command;
    }

    List<String> buildBinarizeCommand(Path input, Path output) {
        return List.of(tools.fslmaths(), input.toString(), "-bin", output.toString());
    }
}
