package github.sarthakdev143.executive_summary.service.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MosaicAssemblerTest {

    private static final int TOLERANCE = 24;

    private final MosaicAssembler assembler = new MosaicAssembler();

    @TempDir
    Path tempDir;

    @Test
    void perfectSquareFillsTheGrid() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        for (int index = 0; index < 9; index++) {
            writeSolidFrame(frames.resolve("P_T1_frame_" + index + ".png"), 218, 218, Color.GRAY);
        }

        Path mosaic = assembler.assemble(frames, tempDir.resolve("T1_mosaic.jpg")).orElseThrow();

        BufferedImage result = ImageIO.read(mosaic.toFile());
        assertThat(result.getWidth()).isEqualTo(654);
        assertThat(result.getHeight()).isEqualTo(654);
    }

    @Test
    void framesBeyondTheSquareAreDropped() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        for (int index = 0; index < 10; index++) {
            writeSolidFrame(frames.resolve("P_T1_frame_" + index + ".png"), 218, 218, Color.GRAY);
        }

        Path mosaic = assembler.assemble(frames, tempDir.resolve("T1_mosaic.jpg")).orElseThrow();

        BufferedImage result = ImageIO.read(mosaic.toFile());
        assertThat(result.getWidth()).isEqualTo(654);
        assertThat(result.getHeight()).isEqualTo(654);
    }

    @Test
    void framesArePlacedInReverseNaturalOrder() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T2_pngs"));
        writeSolidFrame(frames.resolve("P_T2_frame_0.png"), 218, 218, Color.RED);
        writeSolidFrame(frames.resolve("P_T2_frame_1.png"), 218, 218, Color.GREEN);
        writeSolidFrame(frames.resolve("P_T2_frame_2.png"), 218, 218, Color.BLUE);
        writeSolidFrame(frames.resolve("P_T2_frame_10.png"), 218, 218, Color.WHITE);

        Path mosaic = assembler.assemble(frames, tempDir.resolve("T2_mosaic.jpg")).orElseThrow();

        BufferedImage result = ImageIO.read(mosaic.toFile());
        assertThat(result.getWidth()).isEqualTo(436);
        assertColorNear(result, 109, 109, Color.WHITE);
        assertColorNear(result, 327, 109, Color.BLUE);
        assertColorNear(result, 109, 327, Color.GREEN);
        assertColorNear(result, 327, 327, Color.RED);
    }

    @Test
    void framesAreMirroredLeftToRight() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        BufferedImage frame = new BufferedImage(218, 218, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = frame.createGraphics();
        graphics.setColor(Color.RED);
        graphics.fillRect(0, 0, 109, 218);
        graphics.setColor(Color.BLUE);
        graphics.fillRect(109, 0, 109, 218);
        graphics.dispose();
        ImageIO.write(frame, "png", frames.resolve("P_T1_frame_0.png").toFile());

        Path mosaic = assembler.assemble(frames, tempDir.resolve("T1_mosaic.jpg")).orElseThrow();

        BufferedImage result = ImageIO.read(mosaic.toFile());
        assertColorNear(result, 40, 109, Color.BLUE);
        assertColorNear(result, 178, 109, Color.RED);
    }

    @Test
    void largeFramesShrinkKeepingAspectRatio() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        writeSolidFrame(frames.resolve("P_T1_frame_0.png"), 872, 436, Color.WHITE);

        Path mosaic = assembler.assemble(frames, tempDir.resolve("T1_mosaic.jpg")).orElseThrow();

        BufferedImage result = ImageIO.read(mosaic.toFile());
        assertThat(result.getWidth()).isEqualTo(218);
        assertColorNear(result, 109, 50, Color.WHITE);
        assertColorNear(result, 109, 180, Color.BLACK);
    }

    @Test
    void fitWithinNeverEnlarges() {
        BufferedImage small = new BufferedImage(100, 50, BufferedImage.TYPE_INT_RGB);
        assertThat(assembler.fitWithin(small, 218)).isSameAs(small);

        BufferedImage tall = new BufferedImage(300, 900, BufferedImage.TYPE_INT_RGB);
        BufferedImage fitted = assembler.fitWithin(tall, 218);
        assertThat(fitted.getHeight()).isEqualTo(218);
        assertThat(fitted.getWidth()).isEqualTo(73);
    }

    @Test
    void emptyDirectoryWritesNothing() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        Path destination = tempDir.resolve("T1_mosaic.jpg");

        Optional<Path> mosaic = assembler.assemble(frames, destination);

        assertThat(mosaic).isEmpty();
        assertThat(destination).doesNotExist();
    }

    @Test
    void undecodableFrameFailsWithoutPartialOutput() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        writeSolidFrame(frames.resolve("P_T1_frame_0.png"), 218, 218, Color.GRAY);
        Files.writeString(frames.resolve("P_T1_frame_1.png"), "not an image");
        Path destination = tempDir.resolve("T1_mosaic.jpg");

        assertThatThrownBy(() -> assembler.assemble(frames, destination))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("P_T1_frame_1.png");
        assertThat(destination).doesNotExist();
        assertThat(tempDir.resolve("T1_mosaic.jpg.part")).doesNotExist();
    }

    @Test
    void orderedFramesIgnoresSubdirectories() throws Exception {
        Path frames = Files.createDirectories(tempDir.resolve("T1_pngs"));
        Files.createDirectories(frames.resolve("nested"));
        writeSolidFrame(frames.resolve("P_T1_frame_9.png"), 10, 10, Color.GRAY);
        writeSolidFrame(frames.resolve("P_T1_frame_11.png"), 10, 10, Color.GRAY);

        List<Path> ordered = assembler.orderedFrames(frames);

        assertThat(ordered).extracting(path -> path.getFileName().toString())
                .containsExactly("P_T1_frame_11.png", "P_T1_frame_9.png");
    }

    private void writeSolidFrame(Path file, int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(color);
        graphics.fillRect(0, 0, width, height);
        graphics.dispose();
        ImageIO.write(image, "png", file.toFile());
    }

    private void assertColorNear(BufferedImage image, int x, int y, Color expected) {
        Color actual = new Color(image.getRGB(x, y));
        assertThat(Math.abs(actual.getRed() - expected.getRed())).as("red at %d,%d", x, y).isLessThanOrEqualTo(TOLERANCE);
        assertThat(Math.abs(actual.getGreen() - expected.getGreen())).as("green at %d,%d", x, y).isLessThanOrEqualTo(TOLERANCE);
        assertThat(Math.abs(actual.getBlue() - expected.getBlue())).as("blue at %d,%d", x, y).isLessThanOrEqualTo(TOLERANCE);
    }
}
