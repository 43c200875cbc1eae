package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

/**
 * Median traded value under the mode's illiquidity threshold caps the band at Hold.
 * Unknown liquidity is treated as zero.
 */
public class IlliquidityRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.ILLIQUIDITY;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        double mtv = input.medianTradedValueCr() == null ? 0.0 : input.medianTradedValueCr();
        if (mtv < config.illiquidityThreshold(input.mode())) {
            return state.capBand(Band.HOLD, flag());
        }
        return state;
    }
}
