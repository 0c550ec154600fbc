package github.sarthakdev143.executive_summary.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for one pipeline deployment. Bound once at startup and handed to collaborators by
 * constructor, so nothing in the pipeline reads process-wide state for template or atlas locations.
 */
@ConfigurationProperties(prefix = "executive-summary")
public record ExecutiveSummaryProperties(
        @DefaultValue("templates") Path templateDir,
        Path defaultAtlas,
        Path pngsTemplate,
        Path brainspriteTemplate,
        @DefaultValue("900") int renderWidth,
        @DefaultValue("800") int renderHeight,
        Duration toolTimeout,
        @DefaultValue("1") int toolMaxAttempts,
        @DefaultValue("false") boolean keepWorkDir,
        @DefaultValue Tools tools) {

    public static final String DEFAULT_ATLAS_NAME = "MNI152_T1_1mm_brain.nii.gz";
    public static final String DEFAULT_PNGS_TEMPLATE_NAME = "image_template_temp.scene.gz";
    public static final String DEFAULT_BRAINSPRITE_TEMPLATE_NAME = "parasagittal_Tx_169_template.scene.gz";

    public ExecutiveSummaryProperties {
        templateDir = templateDir == null ? Path.of("templates") : templateDir;
        if (renderWidth <= 0 || renderHeight <= 0) {
            throw new IllegalArgumentException("executive-summary.render-width and render-height must be positive.");
        }
        if (toolMaxAttempts < 1) {
            throw new IllegalArgumentException("executive-summary.tool-max-attempts must be at least 1.");
        }
        if (toolTimeout != null && (toolTimeout.isNegative() || toolTimeout.isZero())) {
            toolTimeout = null;
        }
        tools = tools == null ? Tools.defaults() : tools;
    }

    public Path resolveDefaultAtlas() {
        return defaultAtlas != null ? defaultAtlas : templateDir.resolve(DEFAULT_ATLAS_NAME);
    }

    public Path resolvePngsTemplate() {
        return pngsTemplate != null ? pngsTemplate : templateDir.resolve(DEFAULT_PNGS_TEMPLATE_NAME);
    }

    public Path resolveBrainspriteTemplate() {
        return brainspriteTemplate != null
                ? brainspriteTemplate
                : templateDir.resolve(DEFAULT_BRAINSPRITE_TEMPLATE_NAME);
    }

    public record Tools(
            @DefaultValue("wb_command") String wbCommand,
            @DefaultValue("slicer") String slicer,
            @DefaultValue("slicesdir") String slicesdir,
            @DefaultValue("flirt") String flirt,
            @DefaultValue("fslmaths") String fslmaths,
            @DefaultValue("pngappend") String pngappend) {

        public static Tools defaults() {
            return new Tools("wb_command", "slicer", "slicesdir", "flirt", "fslmaths", "pngappend");
        }

        /**
         * Binaries keyed by the property that configures them, in the order the preflight reports them.
         */
        public Map<String, String> byPropertyName() {
            Map<String, String> binaries = new LinkedHashMap<>();
            binaries.put("executive-summary.tools.wb-command", wbCommand);
            binaries.put("executive-summary.tools.slicer", slicer);
            binaries.put("executive-summary.tools.slicesdir", slicesdir);
            binaries.put("executive-summary.tools.flirt", flirt);
            binaries.put("executive-summary.tools.fslmaths", fslmaths);
            binaries.put("executive-summary.tools.pngappend", pngappend);
            return binaries;
        }
    }
}
