package github.sarthakdev143.executive_summary.model;

/**
 * How a scene template spells the placeholders of one token.
 */
public enum TokenStyle {
    /** {@code <TOKEN>_PATH} becomes the absolute path, {@code <TOKEN>_NAME} its file name. */
    PATH_AND_NAME("_PATH"),
    /** {@code <TOKEN>_NAME_and_PATH} becomes the path, {@code <TOKEN>_NAME} its file name. */
    NAME_AND_PATH("_NAME_and_PATH");

    private final String pathSuffix;

    TokenStyle(String pathSuffix) {
        this.pathSuffix = pathSuffix;
    }

    public String pathPlaceholder(String token) {
        return token + pathSuffix;
    }

    public String namePlaceholder(String token) {
        return token + "_NAME";
    }
}
