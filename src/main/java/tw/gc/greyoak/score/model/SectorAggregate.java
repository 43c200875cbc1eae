package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.Horizon;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Equal-weighted sector statistics for one date.
 * A horizon is absent from averageReturns when no member reported that return.
 */
public record SectorAggregate(String sectorGroup, int memberCount,
                              Map<Horizon, Double> averageReturns, Double averageSigma20) {

    public SectorAggregate {
        averageReturns = averageReturns == null || averageReturns.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(averageReturns));
    }

    public Double averageReturn(Horizon horizon) {
        return averageReturns.get(horizon);
    }
}
