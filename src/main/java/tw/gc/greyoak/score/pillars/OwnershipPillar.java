package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.OwnershipRecord;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.normalization.NormalizationEngine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OwnershipPillar (O)
 *
 * Additive tiers, clamped to [0, 100]:
 * institutional holding (35), promoter sweet spot (30), FII/DII flow (10),
 * size (15) and liquidity (10), minus a promoter pledge penalty.
 */
@Component
@Slf4j
public class OwnershipPillar implements PillarCalculator {

    private static final TierLadder INSTITUTIONAL = TierLadder.atLeast(35)
            .step(40, 35).step(25, 25).step(15, 15).step(5, 8);
    private static final TierLadder FLOW = TierLadder.atLeast(10)
            .step(1.0, 10).step(1e-9, 5);
    private static final TierLadder SIZE = TierLadder.atLeast(15)
            .step(50_000, 15).step(10_000, 10).step(2_000, 5);
    private static final TierLadder LIQUIDITY = TierLadder.atLeast(10)
            .step(10, 10).step(5, 5);

    private static final double PROMOTER_MAX = 30.0;

    // Pledge fraction -> penalty points, linear between knots
    private static final double[][] PLEDGE_CURVE = {
            {0.00, 0.0},
            {0.05, 5.0},
            {0.10, 10.0},
            {0.20, 20.0},
            {1.00, 30.0}
    };

    @Override
    public Pillar pillar() {
        return Pillar.O;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        InstrumentSnapshot snapshot = context.snapshot();
        OwnershipRecord ownership = snapshot.getOwnership();

        TierAward institutional = INSTITUTIONAL.award(institutionalHolding(ownership));
        TierAward promoter = promoterAward(ownership.getPromoterHoldPct());
        TierAward flow = FLOW.award(ownership.getFiiDiiDeltaPp());
        TierAward size = SIZE.award(snapshot.getFundamentals().getMarketCapCr());
        TierAward liquidity = LIQUIDITY.award(snapshot.getPrices().resolvedMedianTradedValueCr());
        double pledgePenalty = pledgePenalty(ownership.getPromoterPledgeFrac());

        double total = institutional.points() + promoter.points() + flow.points()
                + size.points() + liquidity.points() - pledgePenalty;
        double score = NormalizationEngine.clampPoints(total);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("institutional", institutional.toDetails());
        details.put("promoter", promoter.toDetails());
        details.put("flow", flow.toDetails());
        details.put("size", size.toDetails());
        details.put("liquidity", liquidity.toDetails());
        details.put("pledgePenalty", pledgePenalty);
        log.debug("O pillar {}: {}", snapshot.getTicker(), score);
        return new PillarScore(Pillar.O, score, details);
    }

    /**
     * FII + DII; one side missing counts as the other alone, both missing is missing
     */
    static Double institutionalHolding(OwnershipRecord ownership) {
        Double fii = ownership.getFiiHoldPct();
        Double dii = ownership.getDiiHoldPct();
        if (fii == null && dii == null) {
            return null;
        }
        return (fii == null ? 0.0 : fii) + (dii == null ? 0.0 : dii);
    }

    /**
     * 50-75% is ideal. Too little skin in the game and too little free float are both penalised.
     */
    static TierAward promoterAward(Double promoterPct) {
        if (promoterPct == null || !Double.isFinite(promoterPct)) {
            return TierAward.missing(PROMOTER_MAX);
        }
        double points;
        if (promoterPct >= 50 && promoterPct <= 75) {
            points = 30;
        } else if ((promoterPct >= 40 && promoterPct < 50) || (promoterPct > 75 && promoterPct <= 80)) {
            points = 20;
        } else if (promoterPct >= 30 && promoterPct < 40) {
            points = 10;
        } else if (promoterPct > 80) {
            points = 5;
        } else {
            points = 0;
        }
        return new TierAward(promoterPct, points, PROMOTER_MAX, false);
    }

    /**
     * Missing pledge data carries no penalty
     */
    static double pledgePenalty(Double pledgeFraction) {
        if (pledgeFraction == null || !Double.isFinite(pledgeFraction) || pledgeFraction <= 0.0) {
            return 0.0;
        }
        double x = Math.min(pledgeFraction, 1.0);
        for (int i = 1; i < PLEDGE_CURVE.length; i++) {
            double[] lo = PLEDGE_CURVE[i - 1];
            double[] hi = PLEDGE_CURVE[i];
            if (x <= hi[0]) {
                return lo[1] + (x - lo[0]) / (hi[0] - lo[0]) * (hi[1] - lo[1]);
            }
        }
        return PLEDGE_CURVE[PLEDGE_CURVE.length - 1][1];
    }
}
