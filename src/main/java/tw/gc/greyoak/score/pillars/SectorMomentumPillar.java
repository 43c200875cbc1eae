package tw.gc.greyoak.score.pillars;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.SectorMomentumReading;
import tw.gc.greyoak.score.normalization.NormalizationEngine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SectorMomentumPillar (S)
 *
 * Reads the sector's S_z from the benchmark and maps it through the same bounded
 * transform as normalization: clamp(50 + 15 * S_z). A sector the benchmark does not
 * know, or a universe with a single sector, gets S_z = 0 and S = 50.
 */
@Component
@Slf4j
public class SectorMomentumPillar implements PillarCalculator {

    @Override
    public Pillar pillar() {
        return Pillar.S;
    }

    @Override
    public PillarScore calculate(PillarContext context) {
        String sector = context.snapshot().getSectorGroup();
        SectorMomentumReading reading = context.benchmark().sectorMomentum().get(sector);
        if (reading == null) {
            reading = SectorMomentumReading.neutral(sector);
        }
        double score = NormalizationEngine.zScoreToPoints(reading.sZ());

        Map<String, Object> details = new LinkedHashMap<>();
        Map<String, Double> horizons = new LinkedHashMap<>();
        reading.horizonZ().forEach((horizon, z) -> horizons.put(horizon.getCode(), z));
        details.put("sectorGroup", sector);
        details.put("horizonZ", horizons);
        details.put("sZ", reading.sZ());
        details.put("sectorCount", context.benchmark().sectorCount());
        log.debug("S pillar {} ({}): S_z={}, score={}", context.snapshot().getTicker(), sector, reading.sZ(), score);
        return new PillarScore(Pillar.S, score, details);
    }

    public double sectorZ(PillarContext context) {
        return context.benchmark().sectorZ(context.snapshot().getSectorGroup());
    }
}
