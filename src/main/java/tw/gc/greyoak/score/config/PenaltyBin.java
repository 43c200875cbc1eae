package tw.gc.greyoak.score.config;

/**
 * Immutable tier boundary and the penalty it awards.
 */
public record PenaltyBin(double threshold, double penalty) {
}
