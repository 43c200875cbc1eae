package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

public class LowCoverageRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.LOW_COVERAGE;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        if (input.imputedFraction() >= config.getGuardrails().lowCoverage()) {
            return state.capBand(Band.HOLD, flag());
        }
        return state;
    }
}
