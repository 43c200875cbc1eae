package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.config.GuardrailThresholds;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;
import tw.gc.greyoak.score.enums.ScoringMode;

/**
 * Sector in a downtrend (S_z at or below the threshold).
 * Trader mode caps the band at Hold and leaves the score alone. Investor mode deducts a fixed
 * penalty, re-derives the band from the new score and keeps the more conservative band.
 */
public class SectorBearRule implements GuardrailRule {

    @Override
    public GuardrailFlag flag() {
        return GuardrailFlag.SECTOR_BEAR;
    }

    @Override
    public GuardrailState apply(GuardrailState state, GuardrailInput input, ScoringConfig config) {
        GuardrailThresholds thresholds = config.getGuardrails();
        if (input.sZ() > thresholds.sectorBearSz()) {
            return state;
        }
        if (input.mode() == ScoringMode.TRADER) {
            return state.capBand(Band.HOLD, flag());
        }
        double adjusted = Math.max(0.0, state.score() - thresholds.sectorBearPenalty());
        return state.rescore(adjusted, config.getBands().bandFor(adjusted), flag());
    }
}
