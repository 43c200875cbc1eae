package tw.gc.greyoak.score.guardrails;

import lombok.Builder;
import tw.gc.greyoak.score.enums.ScoringMode;

/**
 * Everything the guardrail rules look at.
 *
 * @param medianTradedValueCr resolved liquidity; null when unknown, which counts as zero
 * @param pledgeFraction      promoter pledge; null never fires PledgeCap
 */
@Builder
public record GuardrailInput(double scorePreGuard,
                             double confidence,
                             double imputedFraction,
                             double sZ,
                             double riskPenalty,
                             ScoringMode mode,
                             Double medianTradedValueCr,
                             Double pledgeFraction) {
}
