package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

public class PledgeCapRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.PLEDGE_CAP;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        Double pledge = input.pledgeFraction();
        if (pledge != null && pledge > config.getGuardrails().pledgeCap()) {
            return state.capBand(Band.HOLD, flag());
        }
        return state;
    }
}
