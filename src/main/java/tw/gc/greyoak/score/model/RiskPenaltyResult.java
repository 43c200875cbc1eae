package tw.gc.greyoak.score.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capped risk penalty and the factor breakdown behind it.
 * The breakdown also carries total_before_cap, cap and total.
 */
public record RiskPenaltyResult(double total, Map<String, Double> breakdown) {

    public RiskPenaltyResult {
        if (total < 0.0 || !Double.isFinite(total)) {
            throw new IllegalArgumentException("Risk penalty must be a non-negative number, got " + total);
        }
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
