package tw.gc.greyoak.score.config;

public record GuardrailThresholds(double confidence,
                                  double pledgeCap,
                                  double highRiskRp,
                                  double sectorBearSz,
                                  double sectorBearPenalty,
                                  double lowCoverage) {
}
