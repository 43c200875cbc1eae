package tw.gc.greyoak.score.pillars;

import java.util.ArrayList;
import java.util.List;

/**
 * Monotonic step function used by the additive pillars.
 * Steps are checked in declaration order; the first matching step wins, no match scores 0.
 * A missing value scores half the maximum.
 */
final class TierLadder {

    private final double maxPoints;
    private final boolean higherIsBetter;
    private final List<double[]> steps = new ArrayList<>();

    private TierLadder(double maxPoints, boolean higherIsBetter) {
        this.maxPoints = maxPoints;
        this.higherIsBetter = higherIsBetter;
    }

    /**
     * value >= threshold matches
     */
    static TierLadder atLeast(double maxPoints) {
        return new TierLadder(maxPoints, true);
    }

    /**
     * value <= threshold matches
     */
    static TierLadder atMost(double maxPoints) {
        return new TierLadder(maxPoints, false);
    }

    TierLadder step(double threshold, double points) {
        steps.add(new double[]{threshold, points});
        return this;
    }

    double maxPoints() {
        return maxPoints;
    }

    TierAward award(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return TierAward.missing(maxPoints);
        }
        for (double[] step : steps) {
            boolean matches = higherIsBetter ? value >= step[0] : value <= step[0];
            if (matches) {
                return new TierAward(value, step[1], maxPoints, false);
            }
        }
        return new TierAward(value, 0.0, maxPoints, false);
    }
}
