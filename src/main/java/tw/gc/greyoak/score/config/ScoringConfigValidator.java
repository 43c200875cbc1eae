package tw.gc.greyoak.score.config;

import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.ScoringConfigurationException;
import tw.gc.greyoak.score.model.PillarWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Startup checks on {@link ScoringProperties}. All problems are collected and reported together.
 */
public final class ScoringConfigValidator {

    // Risk penalty caps must lie in (0, MAX_RISK_CAP]
    static final double MAX_RISK_CAP = 25.0;

    static final Set<String> STANDARD_FUNDAMENTAL_KEYS =
            Set.of("roe", "sales-cagr", "eps-cagr", "valuation", "leverage", "margin");
    static final Set<String> BANKING_FUNDAMENTAL_KEYS = Set.of("roa", "roe", "gnpa", "pcr", "nim");

    private ScoringConfigValidator() {
        throw new AssertionError("Utility class");
    }

    public static void validate(ScoringProperties properties) {
        List<String> errors = new ArrayList<>();

        if (properties.getCodeVersion() == null || properties.getCodeVersion().isBlank()) {
            errors.add("code-version must be set");
        }
        if (properties.getBatchTimeoutSeconds() <= 0) {
            errors.add("batch-timeout-seconds must be positive");
        }

        List<String> sectors = properties.getSectorGroups();
        if (sectors == null || sectors.isEmpty()) {
            errors.add("sector-groups must not be empty");
            sectors = List.of();
        }
        for (String banking : properties.getBankingSectors()) {
            if (!sectors.contains(banking)) {
                errors.add("banking sector '" + banking + "' is not a configured sector group");
            }
        }

        validatePillarWeights(properties, sectors, errors);
        validateBands(properties.getBands(), errors);
        validateGuardrails(properties.getGuardrails(), errors);
        validateRiskPenalty(properties.getRiskPenalty(), sectors, errors);
        validateTechnicals(properties.getTechnicals(), errors);
        validateBlends(properties, errors);
        validateFundamentals(properties.getFundamentals(), errors);

        if (!errors.isEmpty()) {
            throw new ScoringConfigurationException("Invalid scoring configuration: " + String.join("; ", errors));
        }
    }

    private static void validatePillarWeights(ScoringProperties properties, List<String> sectors, List<String> errors) {
        Map<String, Map<String, Map<String, Double>>> all = properties.getPillarWeights();
        for (ScoringMode mode : ScoringMode.values()) {
            Map<String, Map<String, Double>> byMode = all == null ? null : all.get(mode.getConfigKey());
            if (byMode == null || !byMode.containsKey(ScoringProperties.DEFAULT_KEY)) {
                errors.add("pillar-weights." + mode.getConfigKey() + ".default is required");
                continue;
            }
            for (Map.Entry<String, Map<String, Double>> entry : byMode.entrySet()) {
                String key = entry.getKey();
                if (!ScoringProperties.DEFAULT_KEY.equals(key) && !sectors.contains(key)) {
                    errors.add("pillar-weights." + mode.getConfigKey() + " has unknown sector '" + key + "'");
                    continue;
                }
                try {
                    PillarWeights.fromMap(entry.getValue());
                } catch (ScoringConfigurationException e) {
                    errors.add("pillar-weights." + mode.getConfigKey() + "." + key + ": " + e.getMessage());
                }
            }
        }
        if (all != null) {
            for (String modeKey : all.keySet()) {
                boolean known = false;
                for (ScoringMode mode : ScoringMode.values()) {
                    known |= mode.getConfigKey().equals(modeKey);
                }
                if (!known) {
                    errors.add("pillar-weights has unknown mode '" + modeKey + "'");
                }
            }
        }
    }

    private static void validateBands(ScoringProperties.Bands bands, List<String> errors) {
        if (!(bands.getStrongBuy() > bands.getBuy() && bands.getBuy() > bands.getHold() && bands.getHold() > 0.0)) {
            errors.add("bands must satisfy strong-buy > buy > hold > 0");
        }
        if (bands.getStrongBuy() > AppConstants.MAX_POINTS) {
            errors.add("bands.strong-buy must not exceed 100");
        }
    }

    private static void validateGuardrails(ScoringProperties.Guardrails g, List<String> errors) {
        if (g.getConfidence() < 0.0 || g.getConfidence() > 1.0) {
            errors.add("guardrails.confidence must be within [0, 1]");
        }
        if (g.getLowCoverage() < 0.0 || g.getLowCoverage() > 1.0) {
            errors.add("guardrails.low-coverage must be within [0, 1]");
        }
        if (g.getPledgeCap() < 0.0 || g.getPledgeCap() > 1.0) {
            errors.add("guardrails.pledge-cap must be within [0, 1]");
        }
        if (g.getHighRiskRp() <= 0.0) {
            errors.add("guardrails.high-risk-rp must be positive");
        }
        if (g.getSectorBearPenalty() < 0.0) {
            errors.add("guardrails.sector-bear-penalty must not be negative");
        }
    }

    private static void validateRiskPenalty(ScoringProperties.RiskPenalty rp, List<String> sectors, List<String> errors) {
        if (!rp.getCaps().containsKey(ScoringProperties.DEFAULT_KEY)) {
            errors.add("risk-penalty.caps.default is required");
        }
        rp.getCaps().forEach((sector, cap) -> {
            if (!ScoringProperties.DEFAULT_KEY.equals(sector) && !sectors.contains(sector)) {
                errors.add("risk-penalty.caps has unknown sector '" + sector + "'");
            }
            if (cap == null || cap <= 0.0 || cap > MAX_RISK_CAP) {
                errors.add("risk-penalty.caps." + sector + " must be within (0, " + MAX_RISK_CAP + "]");
            }
        });
        for (ScoringMode mode : ScoringMode.values()) {
            List<ScoringProperties.Bin> bins = rp.getLiquidity().get(mode.getConfigKey());
            if (bins == null || bins.isEmpty()) {
                errors.add("risk-penalty.liquidity." + mode.getConfigKey() + " is required");
            } else {
                checkBins("risk-penalty.liquidity." + mode.getConfigKey(), bins, errors);
            }
        }
        checkBins("risk-penalty.pledge", rp.getPledge(), errors);
        checkBins("risk-penalty.leverage", rp.getLeverage(), errors);

        double[] penalties = {rp.getVolatilityPenalty(), rp.getValuationExtremePenalty(), rp.getValuationElevatedPenalty(),
                rp.getNegativePePenalty(), rp.getThinMarginPenalty(), rp.getNegativeMarginPenalty(), rp.getEventPenalty(),
                rp.getGovernanceLowRoePenalty(), rp.getGovernanceOpmStdevPenalty(), rp.getGovernanceMaxPenalty()};
        for (double penalty : penalties) {
            if (penalty < 0.0) {
                errors.add("risk-penalty penalties must not be negative, got " + penalty);
            }
        }
        if (rp.getVolatilityMultiplier() <= 0.0 || rp.getFallbackSectorSigma20() <= 0.0) {
            errors.add("risk-penalty volatility multiplier and fallback sigma must be positive");
        }
        if (rp.getEventWindowDays() < 0 || rp.getResultsLagDays() < 0) {
            errors.add("risk-penalty event window and results lag must not be negative");
        }
    }

    private static void checkBins(String name, List<ScoringProperties.Bin> bins, List<String> errors) {
        if (bins == null) {
            errors.add(name + " must not be null");
            return;
        }
        for (ScoringProperties.Bin bin : bins) {
            if (bin.getPenalty() < 0.0) {
                errors.add(name + " has a negative penalty");
            }
        }
    }

    private static void validateTechnicals(ScoringProperties.Technicals t, List<String> errors) {
        double sum = t.getAbove200Weight() + t.getGoldenCrossWeight() + t.getRsiWeight()
                + t.getBreakoutWeight() + t.getVolumeWeight();
        if (Math.abs(sum - 1.0) > AppConstants.WEIGHT_SUM_TOLERANCE) {
            errors.add("technicals component weights must sum to 1.0, got " + sum);
        }
        if (t.getRsiLow() >= t.getRsiHigh()) {
            errors.add("technicals.rsi-low must be below rsi-high");
        }
        if (t.getVolumeRatioLow() >= t.getVolumeRatioHigh()) {
            errors.add("technicals.volume-ratio-low must be below volume-ratio-high");
        }
        if (t.getVolumeLookback() <= 0) {
            errors.add("technicals.volume-lookback must be positive");
        }
        if (t.getBreakoutAtrMultiplier() <= 0.0 || t.getBreakoutCloseFraction() <= 0.0) {
            errors.add("technicals breakout scales must be positive");
        }
    }

    private static void validateBlends(ScoringProperties properties, List<String> errors) {
        ScoringProperties.RelativeStrength rs = properties.getRelativeStrength();
        checkSum("relative-strength horizon weights",
                rs.getOneMonthWeight() + rs.getThreeMonthWeight() + rs.getSixMonthWeight(), errors);
        checkSum("relative-strength sector/market blend", rs.getSectorBlend() + rs.getMarketBlend(), errors);

        ScoringProperties.SectorMomentum sm = properties.getSectorMomentum();
        checkSum("sector-momentum horizon weights",
                sm.getOneMonthWeight() + sm.getThreeMonthWeight() + sm.getSixMonthWeight(), errors);
    }

    private static void validateFundamentals(ScoringProperties.Fundamentals f, List<String> errors) {
        checkMetricWeights("fundamentals.standard-weights", f.getStandardWeights(), STANDARD_FUNDAMENTAL_KEYS, errors);
        checkMetricWeights("fundamentals.banking-weights", f.getBankingWeights(), BANKING_FUNDAMENTAL_KEYS, errors);
    }

    private static void checkMetricWeights(String name, Map<String, Double> weights, Set<String> keys, List<String> errors) {
        if (weights == null || !weights.keySet().equals(keys)) {
            errors.add(name + " must define exactly " + keys);
            return;
        }
        double sum = 0.0;
        for (Double w : weights.values()) {
            if (w == null || w < 0.0) {
                errors.add(name + " must not contain negative or empty weights");
                return;
            }
            sum += w;
        }
        checkSum(name, sum, errors);
    }

    private static void checkSum(String name, double sum, List<String> errors) {
        if (Math.abs(sum - 1.0) > AppConstants.WEIGHT_SUM_TOLERANCE) {
            errors.add(name + " must sum to 1.0, got " + sum);
        }
    }
}
