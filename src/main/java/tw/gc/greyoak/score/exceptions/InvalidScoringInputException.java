package tw.gc.greyoak.score.exceptions;

/**
 * Raised before any computation when a scoring request is malformed:
 * bad ticker, unknown mode or sector group, missing records, or a
 * fundamentals variant that does not match the sector.
 */
public class InvalidScoringInputException extends IllegalArgumentException {

    public InvalidScoringInputException(String message) {
        super(message);
    }
}
