package tw.gc.greyoak.score.pillars;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.greyoak.score.TestSnapshots;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.SectorMomentumReading;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SectorMomentumPillar")
class SectorMomentumPillarTest {

    private final ScoringConfig config = ScoringConfig.defaults();
    private final SectorMomentumPillar pillar = new SectorMomentumPillar();

    private double score(String sector, double sZ) {
        InstrumentSnapshot snapshot = TestSnapshots.standard("AAA.NS", sector);
        MarketBenchmark benchmark = new MarketBenchmark(TestSnapshots.DATE, Map.of(), Map.of(),
                Map.of("it", new SectorMomentumReading("it", Map.of(), sZ)), List.of());
        return pillar.calculate(new PillarContext(snapshot, TestSnapshots.peersOf(sector, snapshot),
                benchmark, config)).score();
    }

    @Test
    @DisplayName("should map S_z onto points")
    void shouldMapSectorZ() {
        assertThat(score("it", 1.0)).isEqualTo(65.0);
        assertThat(score("it", -5.0)).isEqualTo(0.0);
        assertThat(score("it", 0.0)).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should score 50 for a sector without a reading")
    void shouldBeNeutralForUnknownSector() {
        assertThat(score("pharma", 2.0)).isEqualTo(50.0);
    }
}
