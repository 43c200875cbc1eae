package tw.gc.greyoak.score.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NormalizationEngine")
class NormalizationEngineTest {

    private static final List<Double> LARGE_SECTOR = List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0);
    private static final List<Double> SMALL_SECTOR = List.of(1.0, 2.0, 3.0);

    @Nested
    @DisplayName("Z-score path")
    class ZScorePath {

        @Test
        @DisplayName("should map the peer mean to 50")
        void shouldMapMeanToFifty() {
            NormalizedPoints result = NormalizationEngine.normalize(LARGE_SECTOR, 35.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.method()).isEqualTo(NormalizationMethod.Z_SCORE);
            assertThat(result.points()).isCloseTo(50.0, within(1e-9));
            assertThat(result.peerCount()).isEqualTo(6);
        }

        @Test
        @DisplayName("should use sample standard deviation")
        void shouldUseSampleStdDev() {
            double std = Math.sqrt(1750.0 / 5.0);

            NormalizedPoints result = NormalizationEngine.normalize(LARGE_SECTOR, 60.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.points()).isCloseTo(50.0 + 15.0 * 25.0 / std, within(1e-9));
        }

        @Test
        @DisplayName("should invert for lower-is-better metrics")
        void shouldInvertForLowerIsBetter() {
            double higher = NormalizationEngine.normalize(LARGE_SECTOR, 60.0, Direction.HIGHER_IS_BETTER).points();
            double lower = NormalizationEngine.normalize(LARGE_SECTOR, 60.0, Direction.LOWER_IS_BETTER).points();

            assertThat(higher + lower).isCloseTo(100.0, within(1e-9));
        }

        @Test
        @DisplayName("should clamp extreme values")
        void shouldClampExtremes() {
            assertThat(NormalizationEngine.normalize(LARGE_SECTOR, 1e9, Direction.HIGHER_IS_BETTER).points()).isEqualTo(100.0);
            assertThat(NormalizationEngine.normalize(LARGE_SECTOR, -1e9, Direction.HIGHER_IS_BETTER).points()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("should return 50 when peers have zero variance")
        void shouldReturnNeutralForZeroVariance() {
            List<Double> flat = List.of(5.0, 5.0, 5.0, 5.0, 5.0, 5.0);

            NormalizedPoints result = NormalizationEngine.normalize(flat, 100.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.points()).isEqualTo(50.0);
            assertThat(result.method()).isEqualTo(NormalizationMethod.DEGENERATE);
        }
    }

    @Nested
    @DisplayName("ECDF path")
    class EcdfPath {

        @Test
        @DisplayName("should rank a peer value as rank / (n + 1)")
        void shouldRankPeerValue() {
            assertThat(NormalizationEngine.normalize(SMALL_SECTOR, 2.0, Direction.HIGHER_IS_BETTER).points())
                    .isCloseTo(50.0, within(1e-9));
            assertThat(NormalizationEngine.normalize(SMALL_SECTOR, 3.0, Direction.HIGHER_IS_BETTER).points())
                    .isCloseTo(75.0, within(1e-9));
        }

        @Test
        @DisplayName("should insert a value that is not among the peers")
        void shouldInsertAbsentValue() {
            NormalizedPoints result = NormalizationEngine.normalize(SMALL_SECTOR, 10.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.method()).isEqualTo(NormalizationMethod.ECDF);
            assertThat(result.points()).isCloseTo(80.0, within(1e-9));
        }

        @Test
        @DisplayName("should average tied ranks")
        void shouldAverageTies() {
            List<Double> tied = List.of(1.0, 2.0, 2.0, 3.0);

            assertThat(NormalizationEngine.normalize(tied, 2.0, Direction.HIGHER_IS_BETTER).points())
                    .isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("should invert for lower-is-better metrics")
        void shouldInvertForLowerIsBetter() {
            assertThat(NormalizationEngine.normalize(SMALL_SECTOR, 1.0, Direction.LOWER_IS_BETTER).points())
                    .isCloseTo(75.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Degenerate inputs")
    class DegenerateInputs {

        @Test
        @DisplayName("should impute 50 for missing or non-finite raw values")
        void shouldImputeMissing() {
            NormalizedPoints missing = NormalizationEngine.normalize(LARGE_SECTOR, null, Direction.HIGHER_IS_BETTER);
            NormalizedPoints nan = NormalizationEngine.normalize(LARGE_SECTOR, Double.NaN, Direction.HIGHER_IS_BETTER);

            assertThat(missing.points()).isEqualTo(50.0);
            assertThat(missing.imputed()).isTrue();
            assertThat(nan.imputed()).isTrue();
        }

        @Test
        @DisplayName("should return 50 for fewer than two peers")
        void shouldReturnNeutralForSinglePeer() {
            NormalizedPoints result = NormalizationEngine.normalize(List.of(5.0), 7.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.points()).isEqualTo(50.0);
            assertThat(result.method()).isEqualTo(NormalizationMethod.DEGENERATE);
        }

        @Test
        @DisplayName("should ignore missing peer values")
        void shouldIgnoreMissingPeers() {
            List<Double> peers = Arrays.asList(1.0, null, 3.0, Double.NaN);

            NormalizedPoints result = NormalizationEngine.normalize(peers, 3.0, Direction.HIGHER_IS_BETTER);

            assertThat(result.peerCount()).isEqualTo(2);
            assertThat(result.method()).isEqualTo(NormalizationMethod.ECDF);
        }
    }

    @Test
    @DisplayName("should be monotone on both paths")
    void shouldBeMonotone() {
        for (List<Double> peers : List.of(LARGE_SECTOR, SMALL_SECTOR)) {
            double previousHigher = -1.0;
            double previousLower = 101.0;
            for (double raw = -100.0; raw <= 100.0; raw += 0.5) {
                double higher = NormalizationEngine.normalize(peers, raw, Direction.HIGHER_IS_BETTER).points();
                double lower = NormalizationEngine.normalize(peers, raw, Direction.LOWER_IS_BETTER).points();
                assertThat(higher).isBetween(0.0, 100.0).isGreaterThanOrEqualTo(previousHigher);
                assertThat(lower).isBetween(0.0, 100.0).isLessThanOrEqualTo(previousLower);
                previousHigher = higher;
                previousLower = lower;
            }
        }
    }

    @Nested
    @DisplayName("Percentile rank")
    class PercentileRank {

        @Test
        @DisplayName("should rank within the distribution as rank / n")
        void shouldRankWithinDistribution() {
            List<Double> distribution = List.of(1.0, 2.0, 3.0, 4.0);

            assertThat(NormalizationEngine.percentileRank(distribution, 4.0)).isCloseTo(100.0, within(1e-9));
            assertThat(NormalizationEngine.percentileRank(distribution, 1.0)).isCloseTo(25.0, within(1e-9));
            assertThat(NormalizationEngine.percentileRank(distribution, 2.5)).isCloseTo(60.0, within(1e-9));
        }

        @Test
        @DisplayName("should return 50 for a tiny distribution")
        void shouldReturnNeutralForTinyDistribution() {
            assertThat(NormalizationEngine.percentileRank(new ArrayList<>(), 1.0)).isEqualTo(50.0);
            assertThat(NormalizationEngine.percentileRank(List.of(1.0), 1.0)).isEqualTo(50.0);
        }
    }

    @Test
    @DisplayName("should map z-scores linearly and clamp")
    void shouldMapZScores() {
        assertThat(NormalizationEngine.zScoreToPoints(0.0)).isEqualTo(50.0);
        assertThat(NormalizationEngine.zScoreToPoints(1.0)).isEqualTo(65.0);
        assertThat(NormalizationEngine.zScoreToPoints(-5.0)).isEqualTo(0.0);
        assertThat(NormalizationEngine.zScoreToPoints(Double.NaN)).isEqualTo(50.0);
    }
}
