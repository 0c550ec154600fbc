package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.model.MosaicGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Composes a frame directory into one brainsprite sprite sheet.
 *
 * <p>Frames are taken in reverse natural order of their file names, mirrored left to right, shrunk to
 * fit a {@value #TILE_SIZE} pixel tile and laid out row by row on a square grid whose side is the integer
 * square root of the frame count. Frames beyond {@code side * side} are not placed; the viewer script
 * expects exactly that grid.
 */
@Component
public class MosaicAssembler {

    private static final Logger logger = LoggerFactory.getLogger(MosaicAssembler.class);

    public static final int TILE_SIZE = 218;
    public static final float JPEG_QUALITY = 0.95f;

    /**
     * @return the written mosaic, or empty when the directory holds no frames
     * @throws IOException when the directory cannot be listed, a frame cannot be decoded, or the mosaic
     *                     cannot be written; nothing is left at {@code destination} in that case
     */
    public Optional<Path> assemble(Path frameDirectory, Path destination) throws IOException {
        List<Path> frames = orderedFrames(frameDirectory);
        MosaicGeometry geometry = MosaicGeometry.forFrames(frames.size(), TILE_SIZE);
        if (geometry.placedFrames() == 0) {
            logger.warn("No frames in {}. No mosaic written.", frameDirectory);
            return Optional.empty();
        }
        if (geometry.placedFrames() < frames.size()) {
            logger.info("{} frames in {}; only the first {} fit a {}x{} grid.",
                    frames.size(), frameDirectory, geometry.placedFrames(), geometry.side(), geometry.side());
        }

        BufferedImage canvas = new BufferedImage(geometry.canvasSize(), geometry.canvasSize(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            for (int index = 0; index < frames.size(); index++) {
                BufferedImage frame = readFrame(frames.get(index));
                if (index >= geometry.placedFrames()) {
                    continue;
                }
                BufferedImage tile = fitWithin(mirror(frame), TILE_SIZE);
                graphics.drawImage(tile, geometry.x(index), geometry.y(index), null);
            }
        } finally {
            graphics.dispose();
        }

        writeJpeg(canvas, destination);
        logger.info("Wrote {}x{} mosaic of {} frames to {}",
                geometry.canvasSize(), geometry.canvasSize(), geometry.placedFrames(), destination);
        return Optional.of(destination);
    }

    /**
     * Regular files of {@code frameDirectory} in reverse natural order of their names.
     */
    public List<Path> orderedFrames(Path frameDirectory) throws IOException {
        try (Stream<Path> entries = Files.list(frameDirectory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .sorted((left, right) -> NaturalOrderComparator.INSTANCE.compare(
                            right.getFileName().toString(),
                            left.getFileName().toString()))
                    .toList();
        }
    }

    BufferedImage mirror(BufferedImage source) {
        BufferedImage mirrored = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = mirrored.createGraphics();
        try {
            AffineTransform flip = AffineTransform.getScaleInstance(-1, 1);
            flip.translate(-source.getWidth(), 0);
            graphics.drawImage(source, flip, null);
        } finally {
            graphics.dispose();
        }
        return mirrored;
    }

    /**
     * Shrinks {@code source} to fit a {@code bound x bound} box keeping its aspect ratio. Images that
     * already fit are returned unchanged; nothing is enlarged.
     */
    BufferedImage fitWithin(BufferedImage source, int bound) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (width <= bound && height <= bound) {
            return source;
        }

        double ratio = Math.min((double) bound / width, (double) bound / height);
        int targetWidth = Math.min(bound, Math.max(1, (int) Math.round(width * ratio)));
        int targetHeight = Math.min(bound, Math.max(1, (int) Math.round(height * ratio)));

        // Halve first, then one bicubic pass to the exact size.
        BufferedImage current = source;
        while (current.getWidth() / 2 >= targetWidth && current.getHeight() / 2 >= targetHeight) {
            current = scale(current, current.getWidth() / 2, current.getHeight() / 2);
        }
        return scale(current, targetWidth, targetHeight);
    }

    private BufferedImage scale(BufferedImage source, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    private BufferedImage readFrame(Path frame) throws IOException {
        BufferedImage image = ImageIO.read(frame.toFile());
        if (image == null) {
            throw new IOException("Cannot decode frame " + frame);
        }
        return image;
    }

    private void writeJpeg(BufferedImage image, Path destination) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available.");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);

        Path partial = destination.resolveSibling(destination.getFileName() + ".part");
        try {
            try (ImageOutputStream output = ImageIO.createImageOutputStream(partial.toFile())) {
                writer.setOutput(output);
                writer.write(null, new IIOImage(image, null, null), param);
            } finally {
                writer.dispose();
            }
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
    }
}
