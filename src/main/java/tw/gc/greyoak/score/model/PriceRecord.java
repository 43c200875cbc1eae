package tw.gc.greyoak.score.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Cleaned price and technical indicators for one instrument on one date.
 * A null field means the value is missing; it is never read as zero.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PriceRecord {

    // Rupees divided by 10^7 gives crores
    private static final double RUPEES_PER_CRORE = 1e7;

    Double close;
    Double volume;
    Double dma20;
    Double dma50;
    Double dma200;
    Double rsi14;
    Double atr14;
    Double hi20;            // 20-day high, excluding today

    Double ret21d;          // trailing returns as fractions
    Double ret63d;
    Double ret126d;
    Double sigma20;         // daily return standard deviations
    Double sigma60;

    Double medianTradedValueCr;

    /**
     * Trailing daily volumes, oldest first, excluding today
     */
    @Builder.Default
    List<Double> volumeHistory = List.of();

    /**
     * Median traded value in crores, falling back to today's volume times close.
     * Returns null when neither source is available.
     */
    public Double resolvedMedianTradedValueCr() {
        if (medianTradedValueCr != null && Double.isFinite(medianTradedValueCr)) {
            return medianTradedValueCr;
        }
        if (volume != null && close != null && Double.isFinite(volume) && Double.isFinite(close)) {
            return volume * close / RUPEES_PER_CRORE;
        }
        return null;
    }
}
