package github.sarthakdev143.executive_summary.model;

/**
 * One entry of the anatomical view catalog.
 *
 * @param contrast     contrast shown by the scene
 * @param view         anatomical view
 * @param sceneOrdinal 1-based scene number inside the anatomical-view template
 */
public record AnatomicalImage(Contrast contrast, AnatomicalView view, int sceneOrdinal) {

    public String imageName() {
        return contrast.label() + "-" + view.viewName();
    }

    public String fileName(String imagesPrefix) {
        return imagesPrefix + "_" + imageName() + ".png";
    }
}
