package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

/**
 * Confidence below the threshold caps the band at Hold.
 */
public class LowDataHoldRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.LOW_DATA_HOLD;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        if (input.confidence() < config.getGuardrails().confidence()) {
            return state.capBand(Band.HOLD, flag());
        }
        return state;
    }
}
