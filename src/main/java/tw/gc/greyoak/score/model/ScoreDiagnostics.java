package tw.gc.greyoak.score.model;

import lombok.Builder;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.Pillar;

import java.util.Map;

/**
 * Intermediate values of a score computation, kept for explanations.
 */
@Builder
public record ScoreDiagnostics(PillarWeights weights,
                               Map<Pillar, Map<String, Object>> pillarDetails,
                               Map<String, Double> riskBreakdown,
                               DataQuality dataQuality,
                               double weightedScore,
                               double preGuardrailScore,
                               Band preGuardrailBand,
                               Double medianTradedValueCr) {
}
