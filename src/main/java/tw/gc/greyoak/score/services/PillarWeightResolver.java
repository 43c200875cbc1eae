package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.model.PillarWeights;

/**
 * Supplies the pillar weight vector for a (sector group, mode): the sector override when one
 * is configured, otherwise the mode default.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PillarWeightResolver {

    private final ScoringConfig config;

    public PillarWeights resolve(String sectorGroup, ScoringMode mode) {
        PillarWeights weights = config.weightsFor(sectorGroup, mode);
        log.debug("Weights for {}/{}: {}", sectorGroup, mode.getCode(), weights);
        return weights;
    }
}
