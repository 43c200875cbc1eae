package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.BankingFundamentals;
import tw.gc.greyoak.score.model.FundamentalsRecord;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.StandardFundamentals;
import tw.gc.greyoak.score.normalization.Direction;
import tw.gc.greyoak.score.normalization.NormalizationEngine;
import tw.gc.greyoak.score.normalization.NormalizedPoints;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * FundamentalsPillar (F)
 *
 * Weighted sum of sector-normalized fundamental metrics. Banks and non-banks use disjoint
 * metric sets; a peer of the other variant contributes nothing to the comparison.
 *
 * Standard: ROE, sales CAGR, EPS CAGR, valuation (EV/EBITDA, else PE), leverage (D/E), margin (OPM).
 * Banking: ROA, ROE, GNPA, PCR, NIM.
 */
@Component
@Slf4j
public class FundamentalsPillar implements PillarCalculator {

    private static final List<Metric<StandardFundamentals>> STANDARD_METRICS = List.of(
            new Metric<>("roe", StandardFundamentals::getRoe3y, Direction.HIGHER_IS_BETTER),
            new Metric<>("sales-cagr", StandardFundamentals::getSalesCagr3y, Direction.HIGHER_IS_BETTER),
            new Metric<>("eps-cagr", StandardFundamentals::getEpsCagr3y, Direction.HIGHER_IS_BETTER),
            new Metric<>("valuation", FundamentalsPillar::valuationMultiple, Direction.LOWER_IS_BETTER),
            new Metric<>("leverage", StandardFundamentals::getDebtToEquity, Direction.LOWER_IS_BETTER),
            new Metric<>("margin", StandardFundamentals::getOpm, Direction.HIGHER_IS_BETTER));

    private static final List<Metric<BankingFundamentals>> BANKING_METRICS = List.of(
            new Metric<>("roa", BankingFundamentals::getRoa3y, Direction.HIGHER_IS_BETTER),
            new Metric<>("roe", BankingFundamentals::getRoe3y, Direction.HIGHER_IS_BETTER),
            new Metric<>("gnpa", BankingFundamentals::getGnpaPct, Direction.LOWER_IS_BETTER),
            new Metric<>("pcr", BankingFundamentals::getPcrPct, Direction.HIGHER_IS_BETTER),
            new Metric<>("nim", BankingFundamentals::getNim3y, Direction.HIGHER_IS_BETTER));

    @Override
    public Pillar pillar() {
        return Pillar.F;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        FundamentalsRecord fundamentals = context.snapshot().getFundamentals();
        if (fundamentals instanceof BankingFundamentals banking) {
            return score(context, banking, BankingFundamentals.class, BANKING_METRICS,
                    context.config().getBankingFundamentalWeights());
        }
        return score(context, (StandardFundamentals) fundamentals, StandardFundamentals.class, STANDARD_METRICS,
                context.config().getStandardFundamentalWeights());
    }

    private <T extends FundamentalsRecord> PillarScore score(PillarContext context, T record, Class<T> variant,
                                                            List<Metric<T>> metrics, Map<String, Double> weights) {
        Map<String, Object> components = new LinkedHashMap<>();
        double total = 0.0;
        int imputed = 0;

        for (Metric<T> metric : metrics) {
            List<Double> peerValues = context.peerSet().values(peer ->
                    variant.isInstance(peer.getFundamentals())
                            ? metric.extractor().apply(variant.cast(peer.getFundamentals()))
                            : null);
            NormalizedPoints points = NormalizationEngine.normalize(
                    peerValues, metric.extractor().apply(record), metric.direction());
            double weight = weights.get(metric.name());
            total += weight * points.points();
            if (points.imputed()) {
                imputed++;
            }

            Map<String, Object> detail = points.toDetails();
            detail.put("weight", weight);
            components.put(metric.name(), detail);
        }

        double score = NormalizationEngine.clampPoints(total);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("variant", record.variant());
        details.put("components", components);
        details.put("imputed", imputed);
        log.debug("F pillar {} ({}): {}", context.snapshot().getTicker(), record.variant(), score);
        return new PillarScore(Pillar.F, score, details);
    }

    /**
     * EV/EBITDA when reported, else PE. Non-positive multiples are not comparable and count as missing.
     */
    static Double valuationMultiple(StandardFundamentals fundamentals) {
        Double multiple = fundamentals.getEvEbitda() != null ? fundamentals.getEvEbitda() : fundamentals.getPe();
        return multiple != null && multiple > 0.0 ? multiple : null;
    }

    private record Metric<T>(String name, Function<T, Double> extractor, Direction direction) {
    }
}
