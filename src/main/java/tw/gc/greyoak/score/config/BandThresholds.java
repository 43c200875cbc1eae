package tw.gc.greyoak.score.config;

import tw.gc.greyoak.score.enums.Band;

/**
 * Score cutoffs, applied both to the initial band and to any re-banding by guardrails.
 */
public record BandThresholds(double strongBuy, double buy, double hold) {

    public Band bandFor(double score) {
        if (score >= strongBuy) {
            return Band.STRONG_BUY;
        }
        if (score >= buy) {
            return Band.BUY;
        }
        if (score >= hold) {
            return Band.HOLD;
        }
        return Band.AVOID;
    }
}
