package tw.gc.greyoak.score.exceptions;

import java.time.LocalDate;

public class SnapshotNotFoundException extends RuntimeException {

    public SnapshotNotFoundException(String ticker, LocalDate date) {
        super("No snapshot for " + ticker + " on " + date);
    }

    public SnapshotNotFoundException(String message) {
        super(message);
    }
}
