package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import github.sarthakdev143.executive_summary.model.AnatomicalImage;
import github.sarthakdev143.executive_summary.model.AnatomicalView;
import github.sarthakdev143.executive_summary.model.Contrast;
import github.sarthakdev143.executive_summary.model.FrameSequence;
import github.sarthakdev143.executive_summary.model.OutputTree;
import github.sarthakdev143.executive_summary.model.PipelineContext;
import github.sarthakdev143.executive_summary.model.PipelineStage;
import github.sarthakdev143.executive_summary.model.ResolvedScene;
import github.sarthakdev143.executive_summary.model.SceneTemplate;
import github.sarthakdev143.executive_summary.model.SliceAxis;
import github.sarthakdev143.executive_summary.model.SubjectInputs;
import github.sarthakdev143.executive_summary.model.SummaryRunReport;
import github.sarthakdev143.executive_summary.model.TokenStyle;
import github.sarthakdev143.executive_summary.service.SceneRenderer;
import github.sarthakdev143.executive_summary.service.SliceRenderer;
import github.sarthakdev143.executive_summary.service.VolumeProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Produces every image of the executive summary for one subject, stage after stage.
 *
 * <p>Stages run strictly in order because later stages read files earlier ones wrote. A missing
 * optional input skips only the images that need it, and a failed external call loses only the image it
 * was producing. The only fatal condition is a missing derivatives root.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final String PNGS_SCENE_NAME = "pngs_scene.scene";
    private static final PathMatcher BOLD_MATCHER = FileSystems.getDefault().getPathMatcher("glob:*task-*_bold*.nii*");
    private static final PathMatcher SBREF_MATCHER = FileSystems.getDefault().getPathMatcher("glob:*task-*_sbref*.nii*");
    private static final String SCOUT_NAME = "Scout_orig.nii.gz";

    // Voxel numbers chosen for the 2 mm MNI template the subcortical ROIs are delivered in.
    private static final Map<SliceAxis, List<Integer>> SUBCORTICAL_SLICES = new EnumMap<>(SliceAxis.class);

    static {
        SUBCORTICAL_SLICES.put(SliceAxis.X, List.of(36, 45, 52));
        SUBCORTICAL_SLICES.put(SliceAxis.Y, List.of(43, 54, 65));
        SUBCORTICAL_SLICES.put(SliceAxis.Z, List.of(23, 33, 39));
    }

    private final ExecutiveSummaryProperties properties;
    private final SceneTemplateEngine templateEngine;
    private final SceneRenderer sceneRenderer;
    private final SliceRenderer sliceRenderer;
    private final VolumeProcessor volumeProcessor;
    private final MosaicAssembler mosaicAssembler;
    private final MeterRegistry meterRegistry;

    public PipelineOrchestrator(
            ExecutiveSummaryProperties properties,
            SceneTemplateEngine templateEngine,
            SceneRenderer sceneRenderer,
            SliceRenderer sliceRenderer,
            VolumeProcessor volumeProcessor,
            MosaicAssembler mosaicAssembler,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.templateEngine = templateEngine;
        this.sceneRenderer = sceneRenderer;
        this.sliceRenderer = sliceRenderer;
        this.volumeProcessor = volumeProcessor;
        this.mosaicAssembler = mosaicAssembler;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws IllegalArgumentException when the derivatives root does not exist
     * @throws InterruptedException     when the run is interrupted while an external tool is running
     */
    public SummaryRunReport run(PipelineContext context, OutputTree tree) throws InterruptedException {
        if (!Files.isDirectory(context.filesPath())) {
            throw new IllegalArgumentException("Directory does not exist: " + context.filesPath());
        }

        RunLedger ledger = new RunLedger();
        SubjectInputs inputs = SubjectInputs.locate(context.filesPath(), context.subjectId());
        logger.info("START: executive summary image preprocessing for {}", context.imagesPrefix());

        generateAtlasImages(context, tree, inputs, ledger);
        boolean hasT2 = detectSecondContrast(inputs);
        generateAnatomicalViews(context, tree, inputs, hasT2, ledger);
        generateBrainspriteFrames(context, tree, inputs, hasT2, ledger);
        generateSubcorticalImages(context, tree, inputs, ledger);
        generateTaskImages(context, tree, inputs, hasT2, ledger);
        generateFunctionalPreviews(context, tree, ledger);
        assembleMosaics(tree, ledger);

        SummaryRunReport report = ledger.toReport();
        logger.info("END: executive summary image preprocessing for {}: {} produced, {} skipped, {} failed",
                context.imagesPrefix(), report.producedArtifacts().size(), report.skipped().size(), report.failures().size());
        return report;
    }

    Path resolveAtlas(PipelineContext context) {
        if (context.atlas() != null) {
            logger.info("Use atlas: {}", context.atlas());
            return context.atlas();
        }
        Path defaultAtlas = properties.resolveDefaultAtlas();
        logger.info("Use default atlas: {}", defaultAtlas);
        return defaultAtlas;
    }

    private void generateAtlasImages(PipelineContext context, OutputTree tree, SubjectInputs inputs, RunLedger ledger)
            throws InterruptedException {
        Path atlas = resolveAtlas(context);
        if (!Files.isRegularFile(atlas)) {
            ledger.skip(PipelineStage.ATLAS, "Missing " + atlas + ". Cannot create atlas-in-t1 or t1-in-atlas.");
            return;
        }
        Path t1Mask = inputs.t1Mask();
        if (!Files.isRegularFile(t1Mask)) {
            ledger.skip(PipelineStage.ATLAS, "Missing " + t1Mask + ". Cannot create atlas-in-t1 or t1-in-atlas.");
            return;
        }

        logger.info("Registering {} and atlas file: {}", t1Mask.getFileName(), atlas);
        String prefix = context.imagesPrefix();
        renderComparison(PipelineStage.ATLAS, t1Mask, atlas,
                tree.imagesDir().resolve(prefix + "_desc-AtlasInT1w.gif"), tree, ledger);
        renderComparison(PipelineStage.ATLAS, atlas, t1Mask,
                tree.imagesDir().resolve(prefix + "_desc-T1wInAtlas.gif"), tree, ledger);
    }

    private boolean detectSecondContrast(SubjectInputs inputs) {
        boolean hasT2 = Files.isRegularFile(inputs.t2());
        if (!hasT2) {
            logger.info("{} not found; using T1 in its place.", inputs.t2());
        }
        if (!Files.isRegularFile(inputs.t2Brain())) {
            logger.info("{} not found.", inputs.t2Brain());
        }
        return hasT2;
    }

    private void generateAnatomicalViews(
            PipelineContext context,
            OutputTree tree,
            SubjectInputs inputs,
            boolean hasT2,
            RunLedger ledger) throws InterruptedException {
        Path templatePath = properties.resolvePngsTemplate();
        if (!Files.isRegularFile(templatePath)) {
            ledger.skip(PipelineStage.ANATOMICAL_VIEWS, "Missing " + templatePath + ". Cannot create anatomical views.");
            return;
        }
        if (!Files.isRegularFile(inputs.t1())) {
            ledger.skip(PipelineStage.ANATOMICAL_VIEWS, "Missing " + inputs.t1() + ". Cannot create anatomical views.");
            return;
        }

        Path sceneFile = tree.workDir().resolve(PNGS_SCENE_NAME);
        try {
            SceneTemplate template = templateEngine.loadTemplate(templatePath, TokenStyle.PATH_AND_NAME);
            Map<String, Path> tokens = templateEngine.pngsTokens(
                    hasT2 ? inputs.t2() : inputs.t1(),
                    inputs.t1(),
                    inputs.rightPial(),
                    inputs.leftPial(),
                    inputs.rightWhite(),
                    inputs.leftWhite());
            templateEngine.writeScene(template, tokens, sceneFile);
        } catch (IOException e) {
            ledger.fail(PipelineStage.ANATOMICAL_VIEWS, sceneFile, e);
            return;
        }

        try {
            for (AnatomicalImage image : AnatomicalView.catalog()) {
                if (image.contrast() == Contrast.T2 && !hasT2) {
                    continue;
                }
                Path outputImage = tree.imagesDir().resolve(image.fileName(context.imagesPrefix()));
                try {
                    sceneRenderer.renderScene(
                            sceneFile,
                            image.sceneOrdinal(),
                            outputImage,
                            properties.renderWidth(),
                            properties.renderHeight());
                    ledger.produce(outputImage);
                } catch (IOException e) {
                    ledger.fail(PipelineStage.ANATOMICAL_VIEWS, outputImage, e);
                }
            }
        } finally {
            deleteQuietly(sceneFile);
        }
    }

    private void generateBrainspriteFrames(
            PipelineContext context,
            OutputTree tree,
            SubjectInputs inputs,
            boolean hasT2,
            RunLedger ledger) throws InterruptedException {
        if (context.skipSprite()) {
            ledger.skip(PipelineStage.BRAINSPRITE, "Skip brainsprite processing per request.");
            return;
        }
        Path templatePath = properties.resolveBrainspriteTemplate();
        if (!Files.isRegularFile(templatePath)) {
            ledger.skip(PipelineStage.BRAINSPRITE,
                    "Missing " + templatePath + ". Cannot perform processing needed for brainsprite.");
            return;
        }

        SceneTemplate template;
        try {
            template = templateEngine.loadTemplate(templatePath, TokenStyle.NAME_AND_PATH);
        } catch (IOException e) {
            ledger.fail(PipelineStage.BRAINSPRITE, templatePath, e);
            return;
        }

        List<Contrast> contrasts = hasT2 ? List.of(Contrast.T1, Contrast.T2) : List.of(Contrast.T1);
        for (Contrast contrast : contrasts) {
            Path image = contrast == Contrast.T1 ? inputs.t1() : inputs.t2();
            renderFrameSequence(contrast, image, template, inputs, tree, ledger).ifPresent(sequence ->
                    logger.info("{} brainsprite: {} frames in {}",
                            sequence.contrast().label(), sequence.size(), sequence.directory()));
        }
    }

    /**
     * Renders one frame per sub-scene of the resolved brainsprite scene into {@code <Tx>_pngs}. A frame
     * that cannot be rendered abandons the whole sequence, since a gap would shift every later frame of
     * the sprite.
     */
    private Optional<FrameSequence> renderFrameSequence(
            Contrast contrast,
            Path image,
            SceneTemplate template,
            SubjectInputs inputs,
            OutputTree tree,
            RunLedger ledger) throws InterruptedException {
        if (!Files.isRegularFile(image)) {
            ledger.skip(PipelineStage.BRAINSPRITE, "Missing " + image + ". No " + contrast.label() + " brainsprite.");
            return Optional.empty();
        }

        String label = contrast.label();
        Path sceneFile = tree.workDir().resolve(label.toLowerCase(Locale.ROOT) + "_bs_scene.scene");
        Path frameDir = frameDirectory(tree, contrast);
        List<Path> frames = new ArrayList<>();
        try {
            ResolvedScene scene = templateEngine.writeScene(
                    template,
                    templateEngine.brainspriteTokens(
                            image, inputs.rightPial(), inputs.leftPial(), inputs.rightWhite(), inputs.leftWhite()),
                    sceneFile);
            int totalFrames = templateEngine.countFrames(scene.text());
            if (totalFrames == 0) {
                ledger.skip(PipelineStage.BRAINSPRITE, "No '" + SceneTemplateEngine.FRAME_MARKER + "' entries in "
                        + template.source() + ". No " + label + " brainsprite.");
                return Optional.empty();
            }

            Files.createDirectories(frameDir);
            logger.info("Rendering {} {} brainsprite frames", totalFrames, label);
            for (int index = 0; index < totalFrames; index++) {
                Path frame = frameDir.resolve("P_" + label + "_frame_" + index + ".png");
                sceneRenderer.renderScene(
                        sceneFile, index + 1, frame, properties.renderWidth(), properties.renderHeight());
                frames.add(frame);
            }
        } catch (IOException e) {
            ledger.fail(PipelineStage.BRAINSPRITE, frameDir, e);
            deleteDirectoryQuietly(frameDir);
            return Optional.empty();
        } finally {
            deleteQuietly(sceneFile);
        }

        ledger.produce(frameDir);
        return Optional.of(new FrameSequence(contrast, frameDir, frames));
    }

    private void generateSubcorticalImages(PipelineContext context, OutputTree tree, SubjectInputs inputs, RunLedger ledger)
            throws InterruptedException {
        if (!Files.isRegularFile(inputs.subcorticalSubject()) || !Files.isRegularFile(inputs.subcorticalAtlas())) {
            ledger.skip(PipelineStage.SUBCORTICAL, "Missing " + inputs.subcorticalAtlas() + " or "
                    + inputs.subcorticalSubject() + ". No subcorticals will be included.");
            return;
        }

        logger.info("Create subcortical images.");
        Path workDir = tree.workDir();
        Path subjectCopy = workDir.resolve("subcort_sub.nii.gz");
        Path atlasCopy = workDir.resolve("subcort_atl.nii.gz");
        Path binarizedAtlas = workDir.resolve("bin_subcort_atl.nii.gz");
        Path binarizedSubject = workDir.resolve("bin_subcort_sub.nii.gz");
        String prefix = context.imagesPrefix();
        Path atlasInSubcortical = tree.imagesDir().resolve(prefix + "_desc-AtlasInSubcort.gif");
        Path subcorticalInAtlas = tree.imagesDir().resolve(prefix + "_desc-SubcortInAtlas.gif");

        try {
            Files.copy(inputs.subcorticalSubject(), subjectCopy, StandardCopyOption.REPLACE_EXISTING);
            Files.copy(inputs.subcorticalAtlas(), atlasCopy, StandardCopyOption.REPLACE_EXISTING);

            // slicer cannot trace edges through low-intensity ROI labels, so outlines use binary masks.
            volumeProcessor.binarize(atlasCopy, binarizedAtlas);
            volumeProcessor.binarize(subjectCopy, binarizedSubject);

            List<Path> atlasInSubcorticalSlices = new ArrayList<>();
            List<Path> subcorticalInAtlasSlices = new ArrayList<>();
            int counter = 0;
            for (Map.Entry<SliceAxis, List<Integer>> axisSlices : SUBCORTICAL_SLICES.entrySet()) {
                for (int sliceNumber : axisSlices.getValue()) {
                    Path atlasSlice = workDir.resolve("slice_atl_" + counter + ".png");
                    sliceRenderer.renderSingleSlice(subjectCopy, binarizedAtlas, axisSlices.getKey(), sliceNumber, atlasSlice);
                    atlasInSubcorticalSlices.add(atlasSlice);

                    Path subjectSlice = workDir.resolve("slice_sub_" + counter + ".png");
                    sliceRenderer.renderSingleSlice(atlasCopy, binarizedSubject, axisSlices.getKey(), sliceNumber, subjectSlice);
                    subcorticalInAtlasSlices.add(subjectSlice);
                    counter++;
                }
            }

            sliceRenderer.appendHorizontally(atlasInSubcorticalSlices, atlasInSubcortical);
            ledger.produce(atlasInSubcortical);
            sliceRenderer.appendHorizontally(subcorticalInAtlasSlices, subcorticalInAtlas);
            ledger.produce(subcorticalInAtlas);
        } catch (IOException e) {
            ledger.fail(PipelineStage.SUBCORTICAL, atlasInSubcortical, e);
        }
    }

    private void generateTaskImages(
            PipelineContext context,
            OutputTree tree,
            SubjectInputs inputs,
            boolean hasT2,
            RunLedger ledger) throws InterruptedException {
        List<Path> taskDirs;
        try {
            taskDirs = findTaskDirectories(inputs.resultsDir());
        } catch (IOException e) {
            ledger.fail(PipelineStage.TASK, inputs.resultsDir(), e);
            return;
        }
        if (taskDirs.isEmpty()) {
            ledger.skip(PipelineStage.TASK, "No task directories under " + inputs.resultsDir() + ".");
            return;
        }

        Path t1Resampled = tree.workDir().resolve("T1w_restore_brain.2.nii.gz");
        Path t2Resampled = tree.workDir().resolve("T2w_restore_brain.2.nii.gz");
        for (Path taskDir : taskDirs) {
            String taskName = taskDir.getFileName().toString();
            logger.info("Make images for {}", taskName);
            Path taskImage = taskDir.resolve(taskName + ".nii.gz");
            if (!Files.isRegularFile(taskImage)) {
                ledger.skip(PipelineStage.TASK, "Missing " + taskImage + ". No images for " + taskName + ".");
                continue;
            }

            String taskPrefix = context.taskPrefix(taskName);
            generateTaskComparisons(Contrast.T1, inputs.t1Brain(), t1Resampled, taskImage, taskPrefix, tree, ledger);
            if (hasT2) {
                generateTaskComparisons(Contrast.T2, inputs.t2Brain(), t2Resampled, taskImage, taskPrefix, tree, ledger);
            }
        }
    }

    private void generateTaskComparisons(
            Contrast contrast,
            Path brain,
            Path resampledBrain,
            Path taskImage,
            String taskPrefix,
            OutputTree tree,
            RunLedger ledger) throws InterruptedException {
        String label = contrast.label();
        if (!Files.isRegularFile(brain)) {
            ledger.skip(PipelineStage.TASK, "Missing " + brain + ". No " + label + " images for " + taskPrefix + ".");
            return;
        }

        try {
            volumeProcessor.resample(brain, taskImage, true, resampledBrain);
        } catch (IOException e) {
            ledger.fail(PipelineStage.TASK, resampledBrain, e);
            return;
        }

        renderComparison(PipelineStage.TASK, taskImage, resampledBrain,
                tree.imagesDir().resolve(taskPrefix + "_desc-" + label + "InTask.gif"), tree, ledger);
        renderComparison(PipelineStage.TASK, resampledBrain, taskImage,
                tree.imagesDir().resolve(taskPrefix + "_desc-TaskIn" + label + ".gif"), tree, ledger);
    }

    List<Path> findTaskDirectories(Path resultsDir) throws IOException {
        if (!Files.isDirectory(resultsDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(resultsDir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(path -> path.getFileName().toString().contains("task-"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    private void generateFunctionalPreviews(PipelineContext context, OutputTree tree, RunLedger ledger)
            throws InterruptedException {
        Path funcPath = context.funcPath();
        if (funcPath == null || !Files.isDirectory(funcPath)) {
            ledger.skip(PipelineStage.FUNCTIONAL, "No func files"
                    + (funcPath == null ? "" : " at " + funcPath) + ". Neither bold nor sbref will be shown.");
            return;
        }

        try {
            for (Path bold : listMatching(funcPath, BOLD_MATCHER)) {
                renderOverview(bold, tree.imagesDir().resolve(previewName(bold)), ledger);
            }

            List<Path> sbrefs = listMatching(funcPath, SBREF_MATCHER);
            if (!sbrefs.isEmpty()) {
                for (Path sbref : sbrefs) {
                    renderOverview(sbref, tree.imagesDir().resolve(previewName(sbref)), ledger);
                }
                return;
            }

            logger.info("No sbref files in {}; using scout images as references.", funcPath);
            for (Path scout : findScouts(context.filesPath())) {
                String taskName = scout.getParent().getFileName().toString();
                renderOverview(scout, tree.imagesDir().resolve(context.taskPrefix(taskName) + "_ref.png"), ledger);
            }
        } catch (IOException e) {
            ledger.fail(PipelineStage.FUNCTIONAL, funcPath, e);
        }
    }

    private void renderOverview(Path volume, Path outputImage, RunLedger ledger) throws InterruptedException {
        try {
            sliceRenderer.renderOverview(volume, outputImage);
            ledger.produce(outputImage);
        } catch (IOException e) {
            ledger.fail(PipelineStage.FUNCTIONAL, outputImage, e);
        }
    }

    List<Path> findScouts(Path filesPath) throws IOException {
        try (Stream<Path> entries = Files.list(filesPath)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(path -> path.getFileName().toString().startsWith("task-"))
                    .map(path -> path.resolve(SCOUT_NAME))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        }
    }

    static String previewName(Path volume) {
        return volume.getFileName().toString()
                .replace(".nii.gz", ".png")
                .replace(".nii", ".png");
    }

    private List<Path> listMatching(Path directory, PathMatcher matcher) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(path.getFileName()))
                    .sorted()
                    .toList();
        }
    }

    private void assembleMosaics(OutputTree tree, RunLedger ledger) {
        for (Contrast contrast : Contrast.values()) {
            Path frameDir = frameDirectory(tree, contrast);
            if (!Files.isDirectory(frameDir)) {
                logger.info("There is no path: {}. No {} mosaic.", frameDir, contrast.label());
                continue;
            }

            Path mosaic = tree.imagesDir().resolve(contrast.label() + "_mosaic.jpg");
            try {
                logger.info("Making mosaic for {} brainsprite.", contrast.label());
                mosaicAssembler.assemble(frameDir, mosaic).ifPresentOrElse(
                        ledger::produce,
                        () -> ledger.skip(PipelineStage.MOSAIC, "No frames in " + frameDir + ". No "
                                + contrast.label() + " mosaic."));
            } catch (IOException e) {
                ledger.fail(PipelineStage.MOSAIC, mosaic, e);
            }
        }
    }

    static Path frameDirectory(OutputTree tree, Contrast contrast) {
        return tree.imagesDir().resolve(contrast.label() + "_pngs");
    }

    private void renderComparison(
            PipelineStage stage,
            Path baseImage,
            Path outlineImage,
            Path destination,
            OutputTree tree,
            RunLedger ledger) throws InterruptedException {
        try {
            Path composed = sliceRenderer.renderDefaultSlices(baseImage, outlineImage, tree.workDir());
            Files.move(composed, destination, StandardCopyOption.REPLACE_EXISTING);
            ledger.produce(destination);
        } catch (IOException e) {
            ledger.fail(stage, destination, e);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove {}", path, e);
        }
    }

    private void deleteDirectoryQuietly(Path directory) {
        try {
            OutputTreeManager.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Could not remove {}", directory, e);
        }
    }

    /**
     * Collects the outcome of one run.
     */
    final class RunLedger {

        private final List<Path> produced = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();

        void produce(Path artifact) {
            produced.add(artifact);
        }

        void skip(PipelineStage stage, String reason) {
            logger.info("[{}] {}", stage.metricTag(), reason);
            skipped.add(reason);
            meterRegistry.counter("executive_summary.stage.skipped", "stage", stage.metricTag()).increment();
        }

        void fail(PipelineStage stage, Path artifact, Exception cause) {
            logger.warn("[{}] Could not produce {}: {}", stage.metricTag(), artifact, cause.getMessage());
            failures.add(artifact.getFileName() + ": " + cause.getMessage());
            meterRegistry.counter("executive_summary.artifact.failures", "stage", stage.metricTag()).increment();
        }

        SummaryRunReport toReport() {
            return new SummaryRunReport(produced, skipped, failures);
        }
    }
}
