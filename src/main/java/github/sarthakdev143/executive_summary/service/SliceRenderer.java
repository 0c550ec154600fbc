package github.sarthakdev143.executive_summary.service;

import github.sarthakdev143.executive_summary.model.SliceAxis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 2-D slice images of volumes.
 */
public interface SliceRenderer {

    /**
     * Renders the default row of nine slices of {@code baseImage}, optionally outlined by the edges of
     * {@code outlineImage}. Scratch output stays inside {@code workDir}.
     *
     * @return the composed image, inside {@code workDir}
     */
    Path renderDefaultSlices(Path baseImage, Path outlineImage, Path workDir) throws IOException, InterruptedException;

    /**
     * Renders a single labelled slice of {@code image} at an absolute voxel number with the edges of
     * {@code edgeImage} drawn on top.
     */
    void renderSingleSlice(Path image, Path edgeImage, SliceAxis axis, int sliceNumber, Path outputImage)
            throws IOException, InterruptedException;

    /**
     * Renders the flat mid-slice preview of {@code image} along all three axes.
     */
    void renderOverview(Path image, Path outputImage) throws IOException, InterruptedException;

    /**
     * Joins images left to right into one.
     */
    void appendHorizontally(List<Path> images, Path outputImage) throws IOException, InterruptedException;
}
