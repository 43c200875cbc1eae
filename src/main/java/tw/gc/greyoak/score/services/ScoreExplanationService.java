package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.guardrails.GuardrailEngine;
import tw.gc.greyoak.score.model.ScoreDiagnostics;
import tw.gc.greyoak.score.model.ScoreExplanation;
import tw.gc.greyoak.score.model.ScoreOutput;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a score output into readable text. Outputs read back from storage have no
 * diagnostics, so weights and the risk breakdown are only shown for fresh scores.
 */
@Service
@RequiredArgsConstructor
public class ScoreExplanationService {

    private static final Set<String> SUMMARY_KEYS = Set.of(
            RiskPenaltyCalculator.TOTAL_BEFORE_CAP, RiskPenaltyCalculator.CAP, RiskPenaltyCalculator.TOTAL);

    private final GuardrailEngine guardrailEngine;

    public ScoreExplanation explain(ScoreOutput output) {
        ScoreDiagnostics diagnostics = output.diagnostics();

        Map<String, String> pillars = new LinkedHashMap<>();
        for (Pillar pillar : Pillar.values()) {
            Double score = output.pillars().get(pillar);
            if (score == null) {
                continue;
            }
            String line = format("%.2f", score);
            if (diagnostics != null && diagnostics.weights() != null) {
                double weight = diagnostics.weights().weightOf(pillar);
                line += format(" x %.2f = %.2f", weight, weight * score);
            }
            pillars.put(pillar.name() + " (" + pillar.getDescription() + ")", line);
        }

        String risk = format("%.2f points", output.riskPenalty());
        if (diagnostics != null && diagnostics.riskBreakdown() != null) {
            StringBuilder factors = new StringBuilder();
            diagnostics.riskBreakdown().forEach((factor, value) -> {
                if (value > 0.0 && !SUMMARY_KEYS.contains(factor)) {
                    factors.append(factors.length() == 0 ? "" : ", ").append(factor).append(format(" %.2f", value));
                }
            });
            if (factors.length() > 0) {
                risk += " (" + factors + ")";
            }
        }

        String quality = format("confidence %.0f%%", output.confidence() * 100);
        if (diagnostics != null && diagnostics.dataQuality() != null
                && !diagnostics.dataQuality().missingFields().isEmpty()) {
            quality += ", missing " + String.join(", ", diagnostics.dataQuality().missingFields());
        }

        String momentum = format("S_z %.3f (%s)", output.sZ(), trend(output.sZ()));

        String summary = format("%s scored %.2f (%s) in %s mode on %s", output.ticker(), output.score(),
                output.band().getLabel(), output.mode().getCode(), output.date());
        if (diagnostics != null) {
            summary += format("; pre-guardrail %.2f (%s)", diagnostics.preGuardrailScore(),
                    diagnostics.preGuardrailBand().getLabel());
        }

        return new ScoreExplanation(output.ticker(), output.date(), output.mode(), output.score(), output.band(),
                summary, pillars, risk, guardrailEngine.summarize(output.guardrailFlags()), quality, momentum);
    }

    private static String trend(double sZ) {
        if (sZ >= 1.0) {
            return "sector leading";
        }
        if (sZ <= -1.0) {
            return "sector lagging";
        }
        return "sector in line";
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
