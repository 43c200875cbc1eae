package tw.gc.greyoak.score.model;

import java.util.List;

/**
 * Coverage of the required input fields for one instrument.
 * confidence = present / required; imputedFraction = 1 - confidence.
 */
public record DataQuality(int requiredFields, int presentFields, List<String> missingFields) {

    public DataQuality {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public double confidence() {
        return requiredFields == 0 ? 0.0 : (double) presentFields / requiredFields;
    }

    public double imputedFraction() {
        return 1.0 - confidence();
    }
}
