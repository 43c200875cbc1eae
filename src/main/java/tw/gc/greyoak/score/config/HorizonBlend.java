package tw.gc.greyoak.score.config;

import tw.gc.greyoak.score.enums.Horizon;

/**
 * Fixed per-horizon weights for 1M, 3M and 6M.
 */
public record HorizonBlend(double oneMonth, double threeMonth, double sixMonth) {

    public double weightOf(Horizon horizon) {
        return switch (horizon) {
            case ONE_MONTH -> oneMonth;
            case THREE_MONTH -> threeMonth;
            case SIX_MONTH -> sixMonth;
        };
    }

    public double sum() {
        return oneMonth + threeMonth + sixMonth;
    }
}
