package tw.gc.greyoak.score.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;

/**
 * Discrete recommendation derived from the final score.
 * Ordered from most to least favourable; rank 0 is the most conservative.
 */
public enum Band {
    STRONG_BUY("Strong Buy", 3),
    BUY("Buy", 2),
    HOLD("Hold", 1),
    AVOID("Avoid", 0);

    private final String label;
    private final int rank;

    Band(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean isMoreFavorableThan(Band other) {
        return rank > other.rank;
    }

    /**
     * The less favourable of the two bands. Used by caps so a band is never raised.
     */
    public Band mostConservative(Band other) {
        return other.rank < rank ? other : this;
    }

    /**
     * Parse from label ("Strong Buy") or enum name ("STRONG_BUY"), case-insensitive
     */
    @JsonCreator
    public static Band fromLabel(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (Band band : values()) {
                if (band.label.equalsIgnoreCase(trimmed) || band.name().equalsIgnoreCase(trimmed)) {
                    return band;
                }
            }
        }
        throw new InvalidScoringInputException("Unknown band: " + value);
    }
}
