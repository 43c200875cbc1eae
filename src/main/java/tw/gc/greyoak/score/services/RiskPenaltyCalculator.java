package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.config.PenaltyBin;
import tw.gc.greyoak.score.config.RiskPenaltyParams;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.model.FundamentalsRecord;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PriceRecord;
import tw.gc.greyoak.score.model.RiskPenaltyResult;
import tw.gc.greyoak.score.model.SectorAggregate;
import tw.gc.greyoak.score.model.StandardFundamentals;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RiskPenaltyCalculator
 *
 * Sums independent, non-negative, threshold-tiered penalties and caps the total per sector.
 *
 * Factors:
 * - liquidity: median traded value against the mode's bins (missing counts as illiquid)
 * - pledge: promoter pledge fraction
 * - volatility: sigma20 above a multiple of the sector average
 * - leverage, extreme valuation, thin margins: non-banking only
 * - event: scoring date close to the expected results date
 * - governance: weak ROE and unstable margins as proxies
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskPenaltyCalculator {

    public static final String TOTAL_BEFORE_CAP = "total_before_cap";
    public static final String CAP = "cap";
    public static final String TOTAL = "total";

    private final ScoringConfig config;

    public RiskPenaltyResult calculate(InstrumentSnapshot snapshot, ScoringMode mode,
                                       MarketBenchmark benchmark, LocalDate scoringDate) {
        RiskPenaltyParams params = config.getRiskPenalty();
        PriceRecord prices = snapshot.getPrices();
        FundamentalsRecord fundamentals = snapshot.getFundamentals();

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("liquidity", liquidityPenalty(prices.resolvedMedianTradedValueCr(), mode));
        breakdown.put("pledge", exceedingBinPenalty(snapshot.getOwnership().getPromoterPledgeFrac(), params.getPledge()));
        breakdown.put("volatility", volatilityPenalty(prices.getSigma20(), benchmark.sector(snapshot.getSectorGroup()), params));

        if (fundamentals instanceof StandardFundamentals standard) {
            breakdown.put("leverage", exceedingBinPenalty(standard.getDebtToEquity(), params.getLeverage()));
            breakdown.put("valuation", valuationPenalty(standard.getPe(), params));
            breakdown.put("margin", marginPenalty(standard.getOpm(), params));
        } else {
            breakdown.put("leverage", 0.0);
            breakdown.put("valuation", 0.0);
            breakdown.put("margin", 0.0);
        }
        breakdown.put("event", eventPenalty(fundamentals.getQuarterEnd(), scoringDate, params));
        breakdown.put("governance", governancePenalty(fundamentals, params));

        double beforeCap = 0.0;
        for (double penalty : breakdown.values()) {
            beforeCap += penalty;
        }
        double cap = config.riskCapFor(snapshot.getSectorGroup());
        double total = Math.min(beforeCap, cap);

        breakdown.put(TOTAL_BEFORE_CAP, beforeCap);
        breakdown.put(CAP, cap);
        breakdown.put(TOTAL, total);
        log.debug("Risk penalty {}: {} (before cap {}, cap {})", snapshot.getTicker(), total, beforeCap, cap);
        return new RiskPenaltyResult(total, breakdown);
    }

    double liquidityPenalty(Double medianTradedValueCr, ScoringMode mode) {
        List<PenaltyBin> bins = config.liquidityBinsFor(mode);
        double worst = 0.0;
        for (PenaltyBin bin : bins) {
            worst = Math.max(worst, bin.penalty());
        }
        if (medianTradedValueCr == null) {
            return worst;
        }
        for (PenaltyBin bin : bins) {
            if (medianTradedValueCr >= bin.threshold()) {
                return bin.penalty();
            }
        }
        return worst;
    }

    /**
     * Bins sorted by descending threshold; the first one exceeded applies
     */
    static double exceedingBinPenalty(Double value, List<PenaltyBin> bins) {
        if (value == null || !Double.isFinite(value)) {
            return 0.0;
        }
        for (PenaltyBin bin : bins) {
            if (value > bin.threshold()) {
                return bin.penalty();
            }
        }
        return 0.0;
    }

    static double volatilityPenalty(Double sigma20, SectorAggregate sector, RiskPenaltyParams params) {
        if (sigma20 == null || !Double.isFinite(sigma20)) {
            return 0.0;
        }
        Double sectorSigma = sector == null ? null : sector.averageSigma20();
        double reference = sectorSigma != null && sectorSigma > 0.0 ? sectorSigma : params.getFallbackSectorSigma20();
        return sigma20 > params.getVolatilityMultiplier() * reference ? params.getVolatilityPenalty() : 0.0;
    }

    static double valuationPenalty(Double pe, RiskPenaltyParams params) {
        if (pe == null || !Double.isFinite(pe)) {
            return 0.0;
        }
        if (pe < 0.0) {
            return params.getNegativePePenalty();
        }
        if (pe > params.getValuationExtremePe()) {
            return params.getValuationExtremePenalty();
        }
        if (pe > params.getValuationElevatedPe()) {
            return params.getValuationElevatedPenalty();
        }
        return 0.0;
    }

    static double marginPenalty(Double opm, RiskPenaltyParams params) {
        if (opm == null || !Double.isFinite(opm)) {
            return 0.0;
        }
        if (opm < 0.0) {
            return params.getNegativeMarginPenalty();
        }
        return opm < params.getThinMarginThreshold() ? params.getThinMarginPenalty() : 0.0;
    }

    /**
     * Results are expected resultsLagDays after the quarter end
     */
    static double eventPenalty(LocalDate quarterEnd, LocalDate scoringDate, RiskPenaltyParams params) {
        if (quarterEnd == null || scoringDate == null) {
            return 0.0;
        }
        LocalDate expectedResults = quarterEnd.plusDays(params.getResultsLagDays());
        long distance = Math.abs(ChronoUnit.DAYS.between(expectedResults, scoringDate));
        return distance <= params.getEventWindowDays() ? params.getEventPenalty() : 0.0;
    }

    static double governancePenalty(FundamentalsRecord fundamentals, RiskPenaltyParams params) {
        double penalty = 0.0;
        Double roe = fundamentals.getRoe3y();
        if (roe != null && roe < params.getGovernanceLowRoe()) {
            penalty += params.getGovernanceLowRoePenalty();
        }
        if (fundamentals instanceof StandardFundamentals standard) {
            Double stdev = standard.getOpmStdev12q();
            if (stdev != null && stdev > params.getGovernanceOpmStdev()) {
                penalty += params.getGovernanceOpmStdevPenalty();
            }
        }
        return Math.min(penalty, params.getGovernanceMaxPenalty());
    }
}
