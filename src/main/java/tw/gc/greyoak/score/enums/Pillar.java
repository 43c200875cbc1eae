package tw.gc.greyoak.score.enums;

/**
 * The six independent scoring dimensions.
 */
public enum Pillar {
    F("Fundamentals"),
    T("Technicals"),
    R("Relative Strength"),
    O("Ownership"),
    Q("Quality"),
    S("Sector Momentum");

    private final String description;

    Pillar(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
