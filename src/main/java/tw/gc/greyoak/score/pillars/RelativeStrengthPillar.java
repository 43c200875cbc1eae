package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Horizon;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.PriceRecord;
import tw.gc.greyoak.score.model.SectorAggregate;
import tw.gc.greyoak.score.normalization.NormalizationEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RelativeStrengthPillar (R)
 *
 * Per horizon, the volatility-scaled excess return over a blend of the sector and market averages:
 * alpha = sectorBlend * (r - sector) / sigma + marketBlend * (r - market) / sigma.
 * Horizon alphas are blended into one weighted alpha, and R is its percentile within
 * the universe distribution held by the benchmark.
 */
@Component
@Slf4j
public class RelativeStrengthPillar implements PillarCalculator {

    @Override
    public Pillar pillar() {
        return Pillar.R;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        AlphaBreakdown alpha = weightedAlpha(context.snapshot().getPrices(), context.snapshot().getSectorGroup(),
                context.benchmark(), context.config());
        double score = NormalizationEngine.percentileRank(context.benchmark().weightedAlphas(), alpha.weightedAlpha());

        Map<String, Object> details = new LinkedHashMap<>();
        Map<String, Double> horizons = new LinkedHashMap<>();
        alpha.alphas().forEach((horizon, value) -> horizons.put(horizon.getCode(), value));
        details.put("alphas", horizons);
        details.put("invalidHorizons", alpha.invalidHorizons().stream().map(Horizon::getCode).toList());
        details.put("weightedAlpha", alpha.weightedAlpha());
        details.put("universeSize", context.benchmark().weightedAlphas().size());
        log.debug("R pillar {}: alpha={}, score={}", context.snapshot().getTicker(), alpha.weightedAlpha(), score);
        return new PillarScore(Pillar.R, score, details);
    }

    /**
     * Weighted alpha of one instrument. Also used to build the universe distribution.
     * A horizon with a missing return or a volatility at or below 1e-8 contributes zero alpha
     * and is reported as invalid.
     */
    public AlphaBreakdown weightedAlpha(PriceRecord prices, String sectorGroup, MarketBenchmark benchmark,
                                        ScoringConfig config) {
        SectorAggregate sector = benchmark.sector(sectorGroup);
        EnumMap<Horizon, Double> alphas = new EnumMap<>(Horizon.class);
        List<Horizon> invalid = new ArrayList<>();
        double weighted = 0.0;

        for (Horizon horizon : Horizon.values()) {
            Double instrumentReturn = horizon.returnOf(prices);
            Double sigma = horizon.volatilityOf(prices);
            double alpha = 0.0;
            if (instrumentReturn == null || sigma == null || !Double.isFinite(sigma) || sigma <= AppConstants.TINY) {
                invalid.add(horizon);
            } else {
                double market = benchmark.marketReturn(horizon);
                Double sectorAverage = sector == null ? null : sector.averageReturn(horizon);
                double sectorReturn = sectorAverage == null ? market : sectorAverage;
                alpha = config.getSectorBlend() * (instrumentReturn - sectorReturn) / sigma
                        + config.getMarketBlend() * (instrumentReturn - market) / sigma;
            }
            alphas.put(horizon, alpha);
            weighted += config.getRelativeStrengthHorizons().weightOf(horizon) * alpha;
        }
        return new AlphaBreakdown(alphas, invalid, weighted);
    }

    public record AlphaBreakdown(Map<Horizon, Double> alphas, List<Horizon> invalidHorizons, double weightedAlpha) {

        public AlphaBreakdown {
            alphas = Collections.unmodifiableMap(new EnumMap<>(alphas));
            invalidHorizons = List.copyOf(invalidHorizons);
        }
    }
}
