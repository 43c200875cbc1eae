package tw.gc.greyoak.score.pillars;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Points awarded by one additive tier component.
 */
record TierAward(Double raw, double points, double maxPoints, boolean imputed) {

    static TierAward missing(double maxPoints) {
        return new TierAward(null, maxPoints / 2.0, maxPoints, true);
    }

    Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("raw", raw);
        details.put("points", points);
        details.put("max", maxPoints);
        details.put("imputed", imputed);
        return details;
    }
}
