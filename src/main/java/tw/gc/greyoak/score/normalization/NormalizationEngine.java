package tw.gc.greyoak.score.normalization;

import tw.gc.greyoak.score.AppConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts raw metric values into 0-100 points relative to a peer group.
 *
 * Large groups (at least {@value #SMALL_SECTOR_THRESHOLD} peers) use a z-score against the
 * peer mean and sample standard deviation, mapped through 50 + 15z and clamped.
 * Smaller groups use the empirical CDF with averaged tie ranks. Missing values,
 * fewer than two peers and zero dispersion all yield the neutral 50.
 */
public final class NormalizationEngine {

    public static final int SMALL_SECTOR_THRESHOLD = 6;
    public static final double POINTS_PER_SIGMA = 15.0;

    private NormalizationEngine() {
        throw new AssertionError("Utility class");
    }

    public static NormalizedPoints normalize(List<Double> peerValues, Double rawValue, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        List<Double> peers = finiteValues(peerValues);
        int n = peers.size();

        if (rawValue == null || !Double.isFinite(rawValue)) {
            return new NormalizedPoints(null, AppConstants.NEUTRAL_POINTS, NormalizationMethod.IMPUTED, n);
        }
        if (n < 2) {
            return new NormalizedPoints(rawValue, AppConstants.NEUTRAL_POINTS, NormalizationMethod.DEGENERATE, n);
        }
        if (n >= SMALL_SECTOR_THRESHOLD) {
            double mean = mean(peers);
            double std = sampleStdDev(peers, mean);
            if (!Double.isFinite(std) || std <= AppConstants.TINY) {
                return new NormalizedPoints(rawValue, AppConstants.NEUTRAL_POINTS, NormalizationMethod.DEGENERATE, n);
            }
            double z = (rawValue - mean) / std;
            if (direction == Direction.LOWER_IS_BETTER) {
                z = -z;
            }
            return new NormalizedPoints(rawValue, zScoreToPoints(z), NormalizationMethod.Z_SCORE, n);
        }
        return new NormalizedPoints(rawValue, ecdfPoints(peers, rawValue, direction), NormalizationMethod.ECDF, n);
    }

    /**
     * Bounded linear map of a z-score onto the point scale
     */
    public static double zScoreToPoints(double z) {
        if (!Double.isFinite(z)) {
            return AppConstants.NEUTRAL_POINTS;
        }
        return clampPoints(AppConstants.NEUTRAL_POINTS + POINTS_PER_SIGMA * z);
    }

    public static double clampPoints(double points) {
        return Math.max(AppConstants.MIN_POINTS, Math.min(AppConstants.MAX_POINTS, points));
    }

    /**
     * Average rank / (n + 1) scaled to 100. The raw value joins the sample when it is not a peer value.
     */
    static double ecdfPoints(List<Double> peers, double rawValue, Direction direction) {
        RankPosition position = averageRank(peers, rawValue, direction);
        return clampPoints(position.rank() / (position.sampleSize() + 1.0) * 100.0);
    }

    /**
     * Percentile of a value within a distribution as average rank / n, scaled to 100.
     * Fewer than two values gives the neutral 50.
     */
    public static double percentileRank(List<Double> distribution, double value) {
        List<Double> values = finiteValues(distribution);
        if (values.size() < 2 || !Double.isFinite(value)) {
            return AppConstants.NEUTRAL_POINTS;
        }
        RankPosition position = averageRank(values, value, Direction.HIGHER_IS_BETTER);
        return clampPoints(position.rank() / position.sampleSize() * 100.0);
    }

    public static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0.0 : sum / values.size();
    }

    /**
     * Sample (n - 1) standard deviation; NaN below two values
     */
    public static double sampleStdDev(List<Double> values, double mean) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (values.size() - 1));
    }

    private static RankPosition averageRank(List<Double> values, double value, Direction direction) {
        int below = 0;
        int equal = 0;
        for (double v : values) {
            if (Math.abs(v - value) <= AppConstants.TINY) {
                equal++;
            } else if (direction == Direction.HIGHER_IS_BETTER ? v < value : v > value) {
                below++;
            }
        }
        int sampleSize = values.size();
        if (equal == 0) {
            equal = 1;
            sampleSize++;
        }
        // ranks below+1 .. below+equal share their average
        double rank = below + (equal + 1) / 2.0;
        return new RankPosition(rank, sampleSize);
    }

    private static List<Double> finiteValues(List<Double> values) {
        List<Double> finite = new ArrayList<>();
        if (values == null) {
            return finite;
        }
        for (Double v : values) {
            if (v != null && Double.isFinite(v)) {
                finite.add(v);
            }
        }
        return finite;
    }

    private record RankPosition(double rank, int sampleSize) {
    }
}
