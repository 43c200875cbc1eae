package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.Pillar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score of one pillar in [0, 100] plus the breakdown that produced it.
 */
public record PillarScore(Pillar pillar, double score, Map<String, Object> details) {

    public PillarScore {
        if (!Double.isFinite(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException(pillar + " score out of range: " + score);
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static PillarScore of(Pillar pillar, double score) {
        return new PillarScore(pillar, score, Map.of());
    }
}
