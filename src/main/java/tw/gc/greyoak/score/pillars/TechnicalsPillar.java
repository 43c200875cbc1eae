package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.TechnicalParams;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.PriceRecord;
import tw.gc.greyoak.score.normalization.NormalizationEngine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TechnicalsPillar (T)
 *
 * Fixed five-component weighted average:
 * - above 200 DMA (binary)
 * - golden cross, 20 DMA over 50 DMA (binary)
 * - RSI mapped linearly across the oversold/overbought band
 * - breakout strength over the 20-day resistance, scaled by max(k1 * ATR, k2 * close)
 * - volume surprise against the trailing average
 *
 * Every component with missing inputs scores the neutral 50.
 */
@Component
@Slf4j
public class TechnicalsPillar implements PillarCalculator {

    private static final double FULL = 100.0;
    private static final double NONE = 0.0;

    @Override
    public Pillar pillar() {
        return Pillar.T;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        PriceRecord prices = context.snapshot().getPrices();
        TechnicalParams params = context.config().getTechnicals();

        double above200 = above(prices.getClose(), prices.getDma200());
        double goldenCross = above(prices.getDma20(), prices.getDma50());
        double rsi = rsiPoints(prices.getRsi14(), params);
        double breakout = breakoutPoints(prices, params);
        double volume = volumeSurprisePoints(prices.getVolume(), prices.getVolumeHistory(), params);

        double total = params.above200Weight() * above200
                + params.goldenCrossWeight() * goldenCross
                + params.rsiWeight() * rsi
                + params.breakoutWeight() * breakout
                + params.volumeWeight() * volume;
        double score = NormalizationEngine.clampPoints(total);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("above200", above200);
        details.put("goldenCross", goldenCross);
        details.put("rsi", rsi);
        details.put("breakout", breakout);
        details.put("volume", volume);
        log.debug("T pillar {}: {}", context.snapshot().getTicker(), score);
        return new PillarScore(Pillar.T, score, details);
    }

    static double above(Double value, Double reference) {
        if (value == null || reference == null || !Double.isFinite(value) || !Double.isFinite(reference)) {
            return AppConstants.NEUTRAL_POINTS;
        }
        return value > reference ? FULL : NONE;
    }

    static double rsiPoints(Double rsi14, TechnicalParams params) {
        if (rsi14 == null || !Double.isFinite(rsi14)) {
            return AppConstants.NEUTRAL_POINTS;
        }
        double scaled = (rsi14 - params.rsiLow()) / (params.rsiHigh() - params.rsiLow()) * FULL;
        return NormalizationEngine.clampPoints(scaled);
    }

    /**
     * 0 at or below resistance, 100 once the gap reaches the volatility-scaled threshold
     */
    static double breakoutPoints(PriceRecord prices, TechnicalParams params) {
        Double close = prices.getClose();
        Double hi20 = prices.getHi20();
        Double dma20 = prices.getDma20();
        Double atr = prices.getAtr14();
        if (close == null || atr == null || (hi20 == null && dma20 == null)) {
            return AppConstants.NEUTRAL_POINTS;
        }
        double resistance = hi20 == null ? dma20 : dma20 == null ? hi20 : Math.max(hi20, dma20);
        double gap = close - resistance;
        if (gap <= 0.0) {
            return NONE;
        }
        double threshold = Math.max(params.breakoutAtrMultiplier() * atr, params.breakoutCloseFraction() * close);
        if (threshold <= AppConstants.TINY) {
            return AppConstants.NEUTRAL_POINTS;
        }
        return NormalizationEngine.clampPoints(FULL * gap / threshold);
    }

    /**
     * Today's volume over the mean of the last lookback sessions, mapped from [low, high] onto [0, 100]
     */
    static double volumeSurprisePoints(Double volume, List<Double> history, TechnicalParams params) {
        int lookback = params.volumeLookback();
        // a non-positive print is a feed gap, not a volume collapse
        if (volume == null || !Double.isFinite(volume) || volume <= 0
                || history == null || history.size() < lookback) {
            return AppConstants.NEUTRAL_POINTS;
        }
        double sum = 0.0;
        int count = 0;
        for (Double v : history.subList(history.size() - lookback, history.size())) {
            if (v != null && Double.isFinite(v)) {
                sum += v;
                count++;
            }
        }
        if (count < lookback || sum / count <= AppConstants.TINY) {
            return AppConstants.NEUTRAL_POINTS;
        }
        double ratio = volume / (sum / count);
        double scaled = (ratio - params.volumeRatioLow()) / (params.volumeRatioHigh() - params.volumeRatioLow()) * FULL;
        return NormalizationEngine.clampPoints(scaled);
    }
}
