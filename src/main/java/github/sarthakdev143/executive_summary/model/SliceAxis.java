package github.sarthakdev143.executive_summary.model;

import java.util.Locale;

public enum SliceAxis {
    X,
    Y,
    Z;

    public String flag() {
        return "-" + name().toLowerCase(Locale.ROOT);
    }
}
