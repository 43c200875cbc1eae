package tw.gc.greyoak.score.pillars;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.greyoak.score.TestSnapshots;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.StandardFundamentals;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QualityPillar")
class QualityPillarTest {

    private final ScoringConfig config = ScoringConfig.defaults();
    private final QualityPillar pillar = new QualityPillar();

    private PillarScore score(InstrumentSnapshot snapshot) {
        return pillar.calculate(new PillarContext(snapshot, TestSnapshots.peersOf(snapshot.getSectorGroup(), snapshot),
                TestSnapshots.emptyBenchmark(), config));
    }

    @Test
    @DisplayName("should score a strong non-bank")
    void shouldScoreStandard() {
        // ROCE 30 + OPM 18 + stability 15 + leverage 20 + dividend 10
        assertThat(score(TestSnapshots.standard("AAA.NS", "it")).score()).isEqualTo(93.0);
    }

    @Test
    @DisplayName("should score a bank on banking metrics")
    void shouldScoreBanking() {
        // ROA 22 + NIM 16 + GNPA 12 + PCR 15 + dividend 10
        PillarScore result = score(TestSnapshots.banking("HDFC.NS", "banks"));

        assertThat(result.score()).isEqualTo(75.0);
        assertThat(result.details()).containsEntry("variant", "banking");
    }

    @Test
    @DisplayName("should award half of each tier when data is missing")
    void shouldAwardHalfWhenMissing() {
        InstrumentSnapshot empty = TestSnapshots.standard("AAA.NS", "it").toBuilder()
                .fundamentals(StandardFundamentals.builder().build())
                .build();

        assertThat(score(empty).score()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should give nothing for negative equity")
    void shouldPenaliseNegativeEquity() {
        assertThat(QualityPillar.leverageAward(-0.5).points()).isEqualTo(0.0);
        assertThat(QualityPillar.leverageAward(0.5).points()).isEqualTo(14.0);
        assertThat(QualityPillar.leverageAward(3.0).points()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("should favour a sustainable payout")
    void shouldFavourSustainablePayout() {
        assertThat(QualityPillar.dividendAward(0.4).points()).isEqualTo(10.0);
        assertThat(QualityPillar.dividendAward(0.75).points()).isEqualTo(5.0);
        assertThat(QualityPillar.dividendAward(0.95).points()).isEqualTo(0.0);
        assertThat(QualityPillar.dividendAward(0.05).points()).isEqualTo(0.0);
        assertThat(QualityPillar.dividendAward(null).points()).isEqualTo(5.0);
    }
}
