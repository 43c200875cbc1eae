package tw.gc.greyoak.score.normalization;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Points in [0, 100] for one raw metric and how they were obtained.
 */
public record NormalizedPoints(Double rawValue, double points, NormalizationMethod method, int peerCount) {

    public boolean imputed() {
        return method == NormalizationMethod.IMPUTED;
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("raw", rawValue);
        details.put("points", points);
        details.put("method", method.name());
        details.put("peers", peerCount);
        return details;
    }
}
