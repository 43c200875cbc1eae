package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.GuardrailFlag;

/**
 * A pure step of the guardrail fold. Returns the state unchanged when it does not fire.
 */
public interface GuardrailRule {

    GuardrailFlag flag();

    GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config);
}
