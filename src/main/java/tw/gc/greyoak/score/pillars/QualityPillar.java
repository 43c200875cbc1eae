package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.BankingFundamentals;
import tw.gc.greyoak.score.model.FundamentalsRecord;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.StandardFundamentals;
import tw.gc.greyoak.score.normalization.NormalizationEngine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * QualityPillar (Q)
 *
 * Additive tiers on absolute thresholds, clamped to [0, 100].
 * Standard: ROCE (30), OPM level (25), OPM stability (15), leverage (20), dividend (10).
 * Banking: ROA (30), NIM (25), GNPA (20), PCR (15), dividend (10).
 */
@Component
@Slf4j
public class QualityPillar implements PillarCalculator {

    private static final TierLadder ROCE = TierLadder.atLeast(30)
            .step(0.20, 30).step(0.15, 22).step(0.10, 14).step(0.05, 6);
    private static final TierLadder OPM = TierLadder.atLeast(25)
            .step(0.25, 25).step(0.15, 18).step(0.08, 10).step(0.0, 4);
    private static final TierLadder OPM_STABILITY = TierLadder.atMost(15)
            .step(0.02, 15).step(0.05, 10).step(0.10, 5);
    private static final TierLadder LEVERAGE = TierLadder.atMost(20)
            .step(0.3, 20).step(0.7, 14).step(1.5, 7);

    private static final TierLadder ROA = TierLadder.atLeast(30)
            .step(0.015, 30).step(0.010, 22).step(0.005, 12);
    private static final TierLadder NIM = TierLadder.atLeast(25)
            .step(0.035, 25).step(0.025, 16).step(0.015, 8);
    private static final TierLadder GNPA = TierLadder.atMost(20)
            .step(2.0, 20).step(4.0, 12).step(8.0, 5);
    private static final TierLadder PCR = TierLadder.atLeast(15)
            .step(70, 15).step(50, 8);

    private static final double DIVIDEND_MAX = 10.0;

    @Override
    public Pillar pillar() {
        return Pillar.Q;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        FundamentalsRecord fundamentals = context.snapshot().getFundamentals();
        Map<String, TierAward> awards = new LinkedHashMap<>();

        if (fundamentals instanceof BankingFundamentals banking) {
            awards.put("roa", ROA.award(banking.getRoa3y()));
            awards.put("nim", NIM.award(banking.getNim3y()));
            awards.put("gnpa", GNPA.award(banking.getGnpaPct()));
            awards.put("pcr", PCR.award(banking.getPcrPct()));
        } else {
            StandardFundamentals standard = (StandardFundamentals) fundamentals;
            awards.put("roce", ROCE.award(standard.getRoce3y()));
            awards.put("opm", OPM.award(standard.getOpm()));
            awards.put("opmStability", OPM_STABILITY.award(standard.getOpmStdev12q()));
            awards.put("leverage", leverageAward(standard.getDebtToEquity()));
        }
        awards.put("dividend", dividendAward(fundamentals.getDividendPayout()));

        double total = 0.0;
        Map<String, Object> components = new LinkedHashMap<>();
        for (Map.Entry<String, TierAward> entry : awards.entrySet()) {
            total += entry.getValue().points();
            components.put(entry.getKey(), entry.getValue().toDetails());
        }
        double score = NormalizationEngine.clampPoints(total);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("variant", fundamentals.variant());
        details.put("components", components);
        log.debug("Q pillar {}: {}", context.snapshot().getTicker(), score);
        return new PillarScore(Pillar.Q, score, details);
    }

    /**
     * Negative D/E means negative equity and earns nothing
     */
    static TierAward leverageAward(Double debtToEquity) {
        if (debtToEquity != null && debtToEquity < 0.0) {
            return new TierAward(debtToEquity, 0.0, LEVERAGE.maxPoints(), false);
        }
        return LEVERAGE.award(debtToEquity);
    }

    /**
     * Sustainable payout is 10-60% of earnings; 60-90% is stretched
     */
    static TierAward dividendAward(Double payout) {
        if (payout == null || !Double.isFinite(payout)) {
            return TierAward.missing(DIVIDEND_MAX);
        }
        double points;
        if (payout >= 0.10 && payout <= 0.60) {
            points = 10;
        } else if (payout > 0.60 && payout <= 0.90) {
            points = 5;
        } else {
            points = 0;
        }
        return new TierAward(payout, points, DIVIDEND_MAX, false);
    }
}
