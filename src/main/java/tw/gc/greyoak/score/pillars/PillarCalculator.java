package tw.gc.greyoak.score.pillars;

import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.model.PillarScore;

/**
 * One scoring dimension. Implementations are stateless and deterministic:
 * the same context always yields the same score.
 */
public interface PillarCalculator {

    Pillar pillar();

    PillarScore calculate(PillarContext context);
}
