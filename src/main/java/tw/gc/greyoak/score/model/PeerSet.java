package tw.gc.greyoak.score.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Read-only group of instruments sharing a sector group on a date.
 */
public record PeerSet(String sectorGroup, LocalDate asOfDate, List<InstrumentSnapshot> members) {

    public PeerSet {
        Objects.requireNonNull(sectorGroup, "sectorGroup");
        members = members == null ? List.of() : List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    /**
     * Present, finite values of a metric across the peers
     */
    public List<Double> values(Function<InstrumentSnapshot, Double> extractor) {
        List<Double> values = new ArrayList<>(members.size());
        for (InstrumentSnapshot member : members) {
            Double value = extractor.apply(member);
            if (value != null && Double.isFinite(value)) {
                values.add(value);
            }
        }
        return values;
    }
}
