package tw.gc.greyoak.score.guardrails;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * GuardrailEngine
 *
 * Folds the pre-guardrail (score, band) through a fixed, ordered list of rules.
 * Each rule is pure; the engine keeps no state between calls, so identical inputs
 * always give identical (score, band, flags). The final band is never more favourable
 * than the band the pre-guardrail score implies.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GuardrailEngine {

    // Evaluation order is part of the contract
    static final List<GuardrailRule> RULES = List.of(
            new LowDataHoldRule(),
            new IlliquidityRule(),
            new PledgeCapRule(),
            new HighRiskCapRule(),
            new SectorBearRule(),
            new LowCoverageRule());

    private final ScoringConfig config;

    public GuardrailState apply(GuardrailInput input) {
        Band initialBand = config.getBands().bandFor(input.scorePreGuard());
        GuardrailState state = GuardrailState.initial(input.scorePreGuard(), initialBand);
        for (GuardrailRule rule : RULES) {
            state = rule.apply(state, input, config);
        }
        if (!state.flags().isEmpty()) {
            log.info("🛡️ Guardrails fired {}: {} -> {} (score {} -> {})",
                    codes(state.flags()), initialBand.getLabel(), state.band().getLabel(),
                    input.scorePreGuard(), state.score());
        }
        return state;
    }

    /**
     * One line per fired flag, in evaluation order
     */
    public List<String> summarize(List<GuardrailFlag> flags) {
        if (flags.isEmpty()) {
            return List.of("No guardrails triggered");
        }
        return flags.stream()
                .map(flag -> flag.getCode() + ": " + flag.getDescription())
                .toList();
    }

    private static String codes(List<GuardrailFlag> flags) {
        return flags.stream().map(GuardrailFlag::getCode).collect(Collectors.joining(","));
    }
}
