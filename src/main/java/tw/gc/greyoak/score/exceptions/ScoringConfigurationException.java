package tw.gc.greyoak.score.exceptions;

/**
 * Raised when the scoring configuration is inconsistent: weights that do not sum to one,
 * non-monotonic band thresholds, out-of-range risk caps or unknown sector keys.
 */
public class ScoringConfigurationException extends IllegalStateException {

    public ScoringConfigurationException(String message) {
        super(message);
    }

    public ScoringConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
