package github.sarthakdev143.executive_summary.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Named anatomical views baked into the anatomical-view scene template. The template holds one scene
 * per view and contrast, T1 before T2, in declaration order.
 */
public enum AnatomicalView {
    AXIAL_INFERIOR_TEMPORAL_CEREBELLUM("Axial-InferiorTemporal-Cerebellum"),
    AXIAL_BASAL_GANGLIA_PUTAMEN("Axial-BasalGangila-Putamen"),
    AXIAL_SUPERIOR_FRONTAL("Axial-SuperiorFrontal"),
    CORONAL_POSTERIOR_PARIETAL_LINGUAL("Coronal-PosteriorParietal-Lingual"),
    CORONAL_CAUDATE_AMYGDALA("Coronal-Caudate-Amygdala"),
    CORONAL_ORBITO_FRONTAL("Coronal-OrbitoFrontal"),
    SAGITTAL_INSULA_FRONTO_TEMPORAL("Sagittal-Insula-FrontoTemporal"),
    SAGITTAL_CORPUS_CALLOSUM("Sagittal-CorpusCallosum"),
    SAGITTAL_INSULA_TEMPORAL_HIPPOCAMPAL_SULCUS("Sagittal-Insula-Temporal-HippocampalSulcus");

    private final String viewName;

    AnatomicalView(String viewName) {
        this.viewName = viewName;
    }

    // Spelling of "BasalGangila" is part of the downstream file naming.
    public String viewName() {
        return viewName;
    }

    // Ordinals are catalog positions and match the scene numbers in the template. A run without T2 renders
    // scenes 1, 3, ..., 17 instead of renumbering its nine images 1..9.
    public static List<AnatomicalImage> catalog() {
        List<AnatomicalImage> catalog = new ArrayList<>();
        int ordinal = 1;
        for (AnatomicalView view : values()) {
            for (Contrast contrast : Contrast.values()) {
                catalog.add(new AnatomicalImage(contrast, view, ordinal++));
            }
        }
        return List.copyOf(catalog);
    }
}
