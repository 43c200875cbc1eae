package tw.gc.greyoak.score.guardrails;

import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable (score, band, flags) triple folded through the rules.
 */
public record GuardrailState(double score, Band band, List<GuardrailFlag> flags) {

    public GuardrailState {
        flags = List.copyOf(flags);
    }

    public static GuardrailState initial(double score, Band band) {
        return new GuardrailState(score, band, List.of());
    }

    /**
     * Lower the band to at most {@code cap} and record the flag. Never raises the band.
     */
    public GuardrailState capBand(Band cap, GuardrailFlag flag) {
        return new GuardrailState(score, band.mostConservative(cap), append(flag));
    }

    /**
     * New score with a re-derived band merged conservatively with the current one
     */
    public GuardrailState rescore(double newScore, Band derivedBand, GuardrailFlag flag) {
        return new GuardrailState(newScore, band.mostConservative(derivedBand), append(flag));
    }

    public boolean hasFlag(GuardrailFlag flag) {
        return flags.contains(flag);
    }

    private List<GuardrailFlag> append(GuardrailFlag flag) {
        List<GuardrailFlag> next = new ArrayList<>(flags);
        next.add(flag);
        return next;
    }
}
