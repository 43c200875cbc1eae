package tw.gc.greyoak.score.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable scoring parameters bound from {@code scoring.*}.
 *
 * Every field carries the production default, so an empty {@code application.yml}
 * still yields a complete configuration. The bound instance is validated and frozen
 * into a {@link ScoringConfig} at startup; nothing reads these setters afterwards.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    public static final String DEFAULT_KEY = "default";

    private String codeVersion = "1.0.0";
    private String dataDir = "data/snapshots";
    private int batchTimeoutSeconds = 300;

    private List<String> sectorGroups = new ArrayList<>(List.of(
            "it", "banks", "psu_banks", "metals", "energy", "fmcg", "pharma", "auto_caps", "diversified"));
    private List<String> bankingSectors = new ArrayList<>(List.of("banks", "psu_banks"));

    /**
     * mode key (trader, investor) -> sector group or "default" -> pillar letter -> weight
     */
    private Map<String, Map<String, Map<String, Double>>> pillarWeights = defaultPillarWeights();

    private Bands bands = new Bands();
    private Guardrails guardrails = new Guardrails();
    private RiskPenalty riskPenalty = new RiskPenalty();
    private Technicals technicals = new Technicals();
    private RelativeStrength relativeStrength = new RelativeStrength();
    private SectorMomentum sectorMomentum = new SectorMomentum();
    private Fundamentals fundamentals = new Fundamentals();

    @Data
    public static class Bands {
        private double strongBuy = 75.0;
        private double buy = 65.0;
        private double hold = 50.0;
    }

    @Data
    public static class Guardrails {
        private double confidence = 0.70;           // LowDataHold below this
        private double pledgeCap = 0.10;            // PledgeCap above this fraction
        private double highRiskRp = 15.0;           // HighRiskCap at or above this penalty
        private double sectorBearSz = -1.5;         // SectorBear at or below this S_z
        private double sectorBearPenalty = 5.0;     // investor-mode score deduction
        private double lowCoverage = 0.25;          // LowCoverage at or above this imputed fraction
    }

    /**
     * A tier boundary. Liquidity bins award the penalty when value >= threshold;
     * pledge and leverage bins when value > threshold.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bin {
        private double threshold;
        private double penalty;
    }

    @Data
    public static class RiskPenalty {
        private Map<String, Double> caps = new LinkedHashMap<>(Map.of(
                DEFAULT_KEY, 20.0,
                "metals", 18.0,
                "fmcg", 12.0));

        private Map<String, List<Bin>> liquidity = defaultLiquidityBins();

        private List<Bin> pledge = new ArrayList<>(List.of(new Bin(0.25, 10.0), new Bin(0.10, 5.0)));

        private double volatilityMultiplier = 2.5;
        private double volatilityPenalty = 5.0;
        private double fallbackSectorSigma20 = 0.03;

        private List<Bin> leverage = new ArrayList<>(List.of(new Bin(2.0, 5.0), new Bin(1.0, 2.0)));

        private double valuationExtremePe = 80.0;
        private double valuationExtremePenalty = 4.0;
        private double valuationElevatedPe = 50.0;
        private double valuationElevatedPenalty = 2.0;
        private double negativePePenalty = 4.0;

        private double thinMarginThreshold = 0.05;
        private double thinMarginPenalty = 3.0;
        private double negativeMarginPenalty = 5.0;

        private int resultsLagDays = 45;            // results expected this long after quarter end
        private int eventWindowDays = 2;
        private double eventPenalty = 2.0;

        private double governanceLowRoe = 0.05;
        private double governanceLowRoePenalty = 2.0;
        private double governanceOpmStdev = 0.10;
        private double governanceOpmStdevPenalty = 1.0;
        private double governanceMaxPenalty = 4.0;
    }

    @Data
    public static class Technicals {
        private double above200Weight = 0.20;
        private double goldenCrossWeight = 0.15;
        private double rsiWeight = 0.20;
        private double breakoutWeight = 0.25;
        private double volumeWeight = 0.20;

        private double rsiLow = 30.0;
        private double rsiHigh = 70.0;
        private double breakoutAtrMultiplier = 0.75;
        private double breakoutCloseFraction = 0.01;
        private int volumeLookback = 20;
        private double volumeRatioLow = 0.5;
        private double volumeRatioHigh = 2.0;
    }

    @Data
    public static class RelativeStrength {
        private double oneMonthWeight = 0.45;
        private double threeMonthWeight = 0.35;
        private double sixMonthWeight = 0.20;
        private double sectorBlend = 0.60;
        private double marketBlend = 0.40;
    }

    @Data
    public static class SectorMomentum {
        private double oneMonthWeight = 0.20;
        private double threeMonthWeight = 0.30;
        private double sixMonthWeight = 0.50;
    }

    @Data
    public static class Fundamentals {
        private Map<String, Double> standardWeights = new LinkedHashMap<>(Map.of(
                "roe", 0.25,
                "sales-cagr", 0.15,
                "eps-cagr", 0.15,
                "valuation", 0.20,
                "leverage", 0.10,
                "margin", 0.15));
        private Map<String, Double> bankingWeights = new LinkedHashMap<>(Map.of(
                "roa", 0.25,
                "roe", 0.20,
                "gnpa", 0.20,
                "pcr", 0.15,
                "nim", 0.20));
    }

    private static Map<String, Map<String, Map<String, Double>>> defaultPillarWeights() {
        Map<String, Map<String, Double>> trader = new LinkedHashMap<>();
        trader.put(DEFAULT_KEY, weights(0.12, 0.32, 0.16, 0.08, 0.04, 0.28));
        trader.put("metals", weights(0.10, 0.34, 0.18, 0.06, 0.04, 0.28));

        Map<String, Map<String, Double>> investor = new LinkedHashMap<>();
        investor.put(DEFAULT_KEY, weights(0.38, 0.10, 0.08, 0.18, 0.12, 0.14));
        investor.put("banks", weights(0.40, 0.08, 0.08, 0.16, 0.14, 0.14));
        investor.put("fmcg", weights(0.34, 0.08, 0.08, 0.16, 0.22, 0.12));

        Map<String, Map<String, Map<String, Double>>> all = new LinkedHashMap<>();
        all.put("trader", trader);
        all.put("investor", investor);
        return all;
    }

    private static Map<String, Double> weights(double f, double t, double r, double o, double q, double s) {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("F", f);
        w.put("T", t);
        w.put("R", r);
        w.put("O", o);
        w.put("Q", q);
        w.put("S", s);
        return w;
    }

    private static Map<String, List<Bin>> defaultLiquidityBins() {
        Map<String, List<Bin>> bins = new LinkedHashMap<>();
        bins.put("trader", new ArrayList<>(List.of(new Bin(5.0, 0.0), new Bin(2.0, 3.0), new Bin(0.0, 10.0))));
        bins.put("investor", new ArrayList<>(List.of(new Bin(2.0, 0.0), new Bin(1.0, 3.0), new Bin(0.0, 8.0))));
        return bins;
    }
}
