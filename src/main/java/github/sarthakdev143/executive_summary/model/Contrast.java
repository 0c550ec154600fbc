package github.sarthakdev143.executive_summary.model;

/**
 * Structural imaging contrasts the report shows side by side.
 */
public enum Contrast {
    T1,
    T2;

    public String label() {
        return name();
    }
}
