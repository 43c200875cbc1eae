package tw.gc.greyoak.score.pillars;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.greyoak.score.TestSnapshots;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Horizon;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PriceRecord;
import tw.gc.greyoak.score.model.SectorAggregate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RelativeStrengthPillar")
class RelativeStrengthPillarTest {

    private final ScoringConfig config = ScoringConfig.defaults();
    private final RelativeStrengthPillar pillar = new RelativeStrengthPillar();

    private MarketBenchmark benchmark(List<Double> alphas) {
        SectorAggregate it = new SectorAggregate("it", 3, Map.of(Horizon.ONE_MONTH, 0.02), 0.02);
        return new MarketBenchmark(TestSnapshots.DATE, Map.of(Horizon.ONE_MONTH, 0.01), Map.of("it", it),
                Map.of(), alphas);
    }

    private static PriceRecord oneMonthOnly(double sigma20) {
        return PriceRecord.builder().ret21d(0.04).sigma20(sigma20).build();
    }

    @Test
    @DisplayName("should blend sector and market excess returns scaled by volatility")
    void shouldBlendExcessReturns() {
        RelativeStrengthPillar.AlphaBreakdown alpha = pillar.weightedAlpha(oneMonthOnly(0.02), "it",
                benchmark(List.of()), config);

        // 0.6 * (0.04 - 0.02) / 0.02 + 0.4 * (0.04 - 0.01) / 0.02 = 1.2
        assertThat(alpha.alphas().get(Horizon.ONE_MONTH)).isCloseTo(1.2, within(1e-9));
        assertThat(alpha.weightedAlpha()).isCloseTo(0.45 * 1.2, within(1e-9));
        assertThat(alpha.invalidHorizons()).containsExactly(Horizon.THREE_MONTH, Horizon.SIX_MONTH);
    }

    @Test
    @DisplayName("should zero a horizon with no volatility")
    void shouldZeroFlatHorizon() {
        RelativeStrengthPillar.AlphaBreakdown alpha = pillar.weightedAlpha(oneMonthOnly(0.0), "it",
                benchmark(List.of()), config);

        assertThat(alpha.weightedAlpha()).isEqualTo(0.0);
        assertThat(alpha.invalidHorizons()).contains(Horizon.ONE_MONTH);
    }

    @Test
    @DisplayName("should fall back to the market when the sector is unknown")
    void shouldFallBackToMarket() {
        RelativeStrengthPillar.AlphaBreakdown alpha = pillar.weightedAlpha(oneMonthOnly(0.02), "pharma",
                benchmark(List.of()), config);

        assertThat(alpha.alphas().get(Horizon.ONE_MONTH)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    @DisplayName("should rank the alpha within the universe distribution")
    void shouldRankWithinUniverse() {
        InstrumentSnapshot snapshot = TestSnapshots.standard("AAA.NS", "it").toBuilder()
                .prices(oneMonthOnly(0.02)).build();
        MarketBenchmark benchmark = benchmark(List.of(-1.0, 0.0, 0.54, 2.0));

        double score = pillar.calculate(new PillarContext(snapshot, TestSnapshots.peersOf("it", snapshot),
                benchmark, config)).score();

        assertThat(score).isCloseTo(75.0, within(1e-6));
    }

    @Test
    @DisplayName("should score 50 against an empty universe")
    void shouldBeNeutralWithoutUniverse() {
        InstrumentSnapshot snapshot = TestSnapshots.standard("AAA.NS", "it");

        assertThat(pillar.calculate(new PillarContext(snapshot, TestSnapshots.peersOf("it", snapshot),
                TestSnapshots.emptyBenchmark(), config)).score()).isEqualTo(50.0);
    }
}
