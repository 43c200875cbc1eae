package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.Horizon;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Cross-sector z-scores of one sector's excess returns and their horizon blend S_z.
 */
public record SectorMomentumReading(String sectorGroup, Map<Horizon, Double> horizonZ, double sZ) {

    public SectorMomentumReading {
        horizonZ = horizonZ == null || horizonZ.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(horizonZ));
    }

    public static SectorMomentumReading neutral(String sectorGroup) {
        return new SectorMomentumReading(sectorGroup, Map.of(), 0.0);
    }
}
