package github.sarthakdev143.executive_summary.model;

import java.util.Locale;

public enum PipelineStage {
    ATLAS,
    ANATOMICAL_VIEWS,
    BRAINSPRITE,
    SUBCORTICAL,
    TASK,
    FUNCTIONAL,
    MOSAIC;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
