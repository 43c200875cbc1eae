package tw.gc.greyoak.score.normalization;

/**
 * Whether a larger raw value is good or bad for the instrument.
 */
public enum Direction {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER
}
