package github.sarthakdev143.executive_summary.model;

import java.nio.file.Path;

/**
 * Where the pipeline expects the preprocessed derivatives of one subject. Nothing here is known to
 * exist; every consumer checks the file it is about to read.
 */
public record SubjectInputs(
        Path atlasSpaceDir,
        Path resultsDir,
        Path roisDir,
        Path t1,
        Path t2,
        Path t1Brain,
        Path t2Brain,
        Path rightWhite,
        Path rightPial,
        Path leftWhite,
        Path leftPial,
        Path subcorticalSubject,
        Path subcorticalAtlas) {

    public static SubjectInputs locate(Path filesPath, String subjectId) {
        Path atlasSpace = filesPath.resolve("MNINonLinear");
        Path surfaces = atlasSpace.resolve("fsaverage_LR32k");
        Path rois = atlasSpace.resolve("ROIs");
        return new SubjectInputs(
                atlasSpace,
                atlasSpace.resolve("Results"),
                rois,
                atlasSpace.resolve("T1w_restore.nii.gz"),
                atlasSpace.resolve("T2w_restore.nii.gz"),
                atlasSpace.resolve("T1w_restore_brain.nii.gz"),
                atlasSpace.resolve("T2w_restore_brain.nii.gz"),
                surfaces.resolve(surfaceName(subjectId, "R", "white")),
                surfaces.resolve(surfaceName(subjectId, "R", "pial")),
                surfaces.resolve(surfaceName(subjectId, "L", "white")),
                surfaces.resolve(surfaceName(subjectId, "L", "pial")),
                rois.resolve("sub2atl_ROI.2.nii.gz"),
                rois.resolve("Atlas_ROIs.2.nii.gz"));
    }

    /**
     * The T1 brain doubles as the T1 mask for atlas comparisons.
     */
    public Path t1Mask() {
        return t1Brain;
    }

    private static String surfaceName(String subjectId, String hemisphere, String surface) {
        return subjectId + "." + hemisphere + "." + surface + ".32k_fs_LR.surf.gii";
    }
}
