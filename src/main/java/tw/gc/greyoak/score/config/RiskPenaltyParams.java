package tw.gc.greyoak.score.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Risk penalty tiers. Caps and liquidity bins live on {@link ScoringConfig}
 * because they are keyed by sector and mode.
 */
@Value
@Builder
public class RiskPenaltyParams {
    List<PenaltyBin> pledge;
    double volatilityMultiplier;
    double volatilityPenalty;
    double fallbackSectorSigma20;
    List<PenaltyBin> leverage;
    double valuationExtremePe;
    double valuationExtremePenalty;
    double valuationElevatedPe;
    double valuationElevatedPenalty;
    double negativePePenalty;
    double thinMarginThreshold;
    double thinMarginPenalty;
    double negativeMarginPenalty;
    int resultsLagDays;
    int eventWindowDays;
    double eventPenalty;
    double governanceLowRoe;
    double governanceLowRoePenalty;
    double governanceOpmStdev;
    double governanceOpmStdevPenalty;
    double governanceMaxPenalty;
}
