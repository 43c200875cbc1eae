package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

public class HighRiskCapRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.HIGH_RISK_CAP;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        if (input.riskPenalty() >= config.getGuardrails().highRiskRp()) {
            return state.capBand(Band.HOLD, flag());
        }
        return state;
    }
}
