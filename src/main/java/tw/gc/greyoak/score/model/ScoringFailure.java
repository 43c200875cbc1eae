package tw.gc.greyoak.score.model;

/**
 * An instrument a batch could not score, and why.
 */
public record ScoringFailure(String ticker, String reason) {
}
