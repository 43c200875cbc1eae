package tw.gc.greyoak.score.data;

import tw.gc.greyoak.score.model.InstrumentSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Supplies cleaned instrument snapshots. Acquisition and cleaning happen upstream.
 */
public interface SnapshotProvider {

    /**
     * Every snapshot for a date; empty when nothing is available
     */
    List<InstrumentSnapshot> loadUniverse(LocalDate date);

    default Optional<InstrumentSnapshot> loadSnapshot(String ticker, LocalDate date) {
        return loadUniverse(date).stream()
                .filter(snapshot -> ticker.equals(snapshot.getTicker()))
                .findFirst();
    }
}
