package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.Horizon;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-date aggregates shared read-only by every instrument in a scoring run.
 *
 * @param marketReturns   equal-weighted universe return per horizon (0.0 when nobody reported)
 * @param sectors         per-sector averages, keyed by sector group
 * @param sectorMomentum  per-sector S_z table
 * @param weightedAlphas  sorted distribution of relative-strength weighted alphas
 */
public record MarketBenchmark(LocalDate asOfDate,
                              Map<Horizon, Double> marketReturns,
                              Map<String, SectorAggregate> sectors,
                              Map<String, SectorMomentumReading> sectorMomentum,
                              List<Double> weightedAlphas) {

    public MarketBenchmark {
        marketReturns = marketReturns == null || marketReturns.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(marketReturns));
        sectors = sectors == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(sectors));
        sectorMomentum = sectorMomentum == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(sectorMomentum));
        weightedAlphas = weightedAlphas == null ? List.of() : List.copyOf(weightedAlphas);
    }

    public double marketReturn(Horizon horizon) {
        return marketReturns.getOrDefault(horizon, 0.0);
    }

    public SectorAggregate sector(String sectorGroup) {
        return sectors.get(sectorGroup);
    }

    public int sectorCount() {
        return sectors.size();
    }

    /**
     * S_z of a sector; 0 for a sector the benchmark does not know
     */
    public double sectorZ(String sectorGroup) {
        SectorMomentumReading reading = sectorMomentum.get(sectorGroup);
        return reading == null ? 0.0 : reading.sZ();
    }
}
