package github.sarthakdev143.executive_summary.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Voxel-level operations performed by external tools.
 */
public interface VolumeProcessor {

    /**
     * Resamples {@code moving} into the space of {@code reference}. With {@code applyExistingTransform}
     * the tool applies an identity transform instead of estimating a registration.
     */
    void resample(Path moving, Path reference, boolean applyExistingTransform, Path output)
            throws IOException, InterruptedException;

    /**
     * Writes a label volume that is 1 wherever {@code input} is non-zero and 0 elsewhere.
     */
    void binarize(Path input, Path output) throws IOException, InterruptedException;
}
