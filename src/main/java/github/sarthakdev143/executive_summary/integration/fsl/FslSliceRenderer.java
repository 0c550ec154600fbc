package github.sarthakdev143.executive_summary.integration.fsl;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import github.sarthakdev143.executive_summary.integration.process.ExternalCommandRunner;
import github.sarthakdev143.executive_summary.model.SliceAxis;
import github.sarthakdev143.executive_summary.service.SliceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Slice images through the FSL command line tools {@code slicesdir}, {@code slicer} and
 * {@code pngappend}.
 */
@Component
public class FslSliceRenderer implements SliceRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FslSliceRenderer.class);
    static final String SLICESDIR_OUTPUT_DIR = "slicesdir";

    private final ExternalCommandRunner commandRunner;
    private final ExecutiveSummaryProperties.Tools tools;

    public FslSliceRenderer(ExternalCommandRunner commandRunner, ExecutiveSummaryProperties properties) {
        this.commandRunner = commandRunner;
        this.tools = properties.tools();
    }

    @Override
    public Path renderDefaultSlices(Path baseImage, Path outlineImage, Path workDir)
            throws IOException, InterruptedException {
        // slicesdir names its output after the path it was given, so it gets a file name relative to
        // its own working directory.
        String localName = baseImage.getFileName().toString();
        Path localCopy = workDir.resolve(localName);
        boolean copied = false;
        if (!Files.exists(localCopy) || !Files.isSameFile(localCopy, baseImage)) {
            Files.copy(baseImage, localCopy, StandardCopyOption.REPLACE_EXISTING);
            copied = true;
        }

        Path slicesDir = workDir.resolve(SLICESDIR_OUTPUT_DIR);
        Path produced = slicesDir.resolve(stripVolumeExtension(localName) + ".png");
        Path result = workDir.resolve(stripVolumeExtension(localName) + "_slices.png");
        try {
            commandRunner.run(
                    buildSlicesdirCommand(localName, outlineImage),
                    "default slices of " + localName,
                    workDir,
                    produced);
            Files.move(produced, result, StandardCopyOption.REPLACE_EXISTING);
            return result;
        } finally {
            deleteRecursively(slicesDir);
            if (copied) {
                Files.deleteIfExists(localCopy);
            }
        }
    }

    @Override
    public void renderSingleSlice(Path image, Path edgeImage, SliceAxis axis, int sliceNumber, Path outputImage)
            throws IOException, InterruptedException {
        commandRunner.run(
                buildSingleSliceCommand(image, edgeImage, axis, sliceNumber, outputImage),
                "slice " + axis + "=" + sliceNumber + " of " + image.getFileName(),
                null,
                outputImage);
    }

    @Override
    public void renderOverview(Path image, Path outputImage) throws IOException, InterruptedException {
        commandRunner.run(
                buildOverviewCommand(image, outputImage),
                "overview of " + image.getFileName(),
                null,
                outputImage);
    }

    @Override
    public void appendHorizontally(List<Path> images, Path outputImage) throws IOException, InterruptedException {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required to append.");
        }
        commandRunner.run(
                buildAppendCommand(images, outputImage),
                "append " + images.size() + " images into " + outputImage.getFileName(),
                null,
                outputImage);
    }

    List<String> buildSlicesdirCommand(String localBaseName, Path outlineImage) {
        List<String> command = new ArrayList<>();
        command.add(tools.slicesdir());
        if (outlineImage != null) {
            command.add("-p");
            command.add(outlineImage.toAbsolutePath().toString());
        }
        command.add(localBaseName);
        return command;
    }

    List<String> buildSingleSliceCommand(Path image, Path edgeImage, SliceAxis axis, int sliceNumber, Path outputImage) {
        List<String> command = new ArrayList<>();
        command.add(tools.slicer());
        command.add(image.toString());
        if (edgeImage != null) {
            command.add(edgeImage.toString());
        }
        command.add("-u");
        command.add("-L");
        command.add(axis.flag());
        // Negative positions are absolute voxel numbers for slicer.
        command.add(String.valueOf(-Math.abs(sliceNumber)));
        command.add(outputImage.toString());
        return command;
    }

    List<String> buildOverviewCommand(Path image, Path outputImage) {
        return List.of(tools.slicer(), image.toString(), "-u", "-a", outputImage.toString());
    }

    List<String> buildAppendCommand(List<Path> images, Path outputImage) {
        List<String> command = new ArrayList<>();
        command.add(tools.pngappend());
        for (int index = 0; index < images.size(); index++) {
            if (index > 0) {
                command.add("+");
            }
            command.add(images.get(index).toString());
        }
        command.add(outputImage.toString());
        return command;
    }

    static String stripVolumeExtension(String fileName) {
        if (fileName.endsWith(".nii.gz")) {
            return fileName.substring(0, fileName.length() - ".nii.gz".length());
        }
        if (fileName.endsWith(".nii")) {
            return fileName.substring(0, fileName.length() - ".nii".length());
        }
        return fileName;
    }

    private void deleteRecursively(Path directory) {
        if (Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.warn("Could not remove {}", path, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up {}", directory, e);
        }
    }
}
