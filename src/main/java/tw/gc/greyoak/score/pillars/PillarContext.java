package tw.gc.greyoak.score.pillars;

import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PeerSet;

import java.util.Objects;

/**
 * Read-only inputs shared by every pillar for one instrument.
 */
public record PillarContext(InstrumentSnapshot snapshot,
                            PeerSet peerSet,
                            MarketBenchmark benchmark,
                            ScoringConfig config) {

    public PillarContext {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(peerSet, "peerSet");
        Objects.requireNonNull(benchmark, "benchmark");
        Objects.requireNonNull(config, "config");
    }
}
