package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.data.SnapshotProvider;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;
import tw.gc.greyoak.score.exceptions.SnapshotNotFoundException;
import tw.gc.greyoak.score.model.BatchScoreResult;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PeerSet;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.model.ScoringFailure;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * BatchScoringService
 *
 * Scores a whole universe for one date. Invalid snapshots are reported and left out of the
 * peer sets and the benchmark, which are built once and shared read-only. Instruments are
 * scored on a fixed pool bounded by the CPU count; one failure never aborts the batch.
 * The batch timeout marks unfinished instruments as failed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchScoringService {

    private static final int MAX_PARALLEL_TASKS = Runtime.getRuntime().availableProcessors();

    private final ScoringConfig config;
    private final ScoringService scoringService;
    private final MarketBenchmarkService benchmarkService;
    private final PillarWeightResolver weightResolver;
    private final ScoringInputValidator validator;
    private final SnapshotProvider snapshotProvider;

    /**
     * Score every snapshot the provider has for the date
     */
    public BatchScoreResult scoreDate(LocalDate date, ScoringMode mode) {
        return scoreUniverse(snapshotProvider.loadUniverse(date), mode, date);
    }

    /**
     * Score one ticker against its date's universe
     *
     * @throws SnapshotNotFoundException when the provider has no snapshot for the ticker
     */
    public ScoreOutput scoreTicker(String ticker, LocalDate date, ScoringMode mode) {
        validator.validateTicker(ticker);
        List<InstrumentSnapshot> universe = snapshotProvider.loadUniverse(date);
        InstrumentSnapshot target = universe.stream()
                .filter(snapshot -> ticker.equals(snapshot.getTicker()))
                .findFirst()
                .orElseThrow(() -> new SnapshotNotFoundException(ticker, date));
        validator.validate(target, mode, date);

        List<InstrumentSnapshot> comparable = validOnly(universe, mode, date, new ArrayList<>());
        PeerSet peers = benchmarkService.peerSets(date, comparable).get(target.getSectorGroup());
        MarketBenchmark benchmark = benchmarkService.build(date, comparable);
        return scoringService.computeScore(target, peers, benchmark,
                weightResolver.resolve(target.getSectorGroup(), mode), mode, date);
    }

    public BatchScoreResult scoreUniverse(List<InstrumentSnapshot> universe, ScoringMode mode, LocalDate date) {
        long started = System.currentTimeMillis();
        log.info("🚀 Batch scoring {} instruments for {} in {} mode", universe.size(), date, mode.getCode());

        List<ScoringFailure> failures = new ArrayList<>();
        List<InstrumentSnapshot> valid = validOnly(universe, mode, date, failures);
        if (valid.isEmpty()) {
            log.warn("⚠️ Nothing to score for {} ({} invalid)", date, failures.size());
            return new BatchScoreResult(date, mode, universe.size(), List.of(), sortFailures(failures));
        }

        Map<String, PeerSet> peerSets = benchmarkService.peerSets(date, valid);
        MarketBenchmark benchmark = benchmarkService.build(date, valid);

        List<ScoreOutput> outputs = new ArrayList<>(valid.size());
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(MAX_PARALLEL_TASKS, valid.size())));
        try {
            Map<String, Future<ScoreOutput>> futures = new LinkedHashMap<>();
            for (InstrumentSnapshot snapshot : valid) {
                futures.put(snapshot.getTicker(), executor.submit(() -> scoringService.computeScore(
                        snapshot, peerSets.get(snapshot.getSectorGroup()), benchmark,
                        weightResolver.resolve(snapshot.getSectorGroup(), mode), mode, date)));
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getBatchTimeoutSeconds());
            for (Map.Entry<String, Future<ScoreOutput>> entry : futures.entrySet()) {
                String ticker = entry.getKey();
                Future<ScoreOutput> future = entry.getValue();
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    outputs.add(future.get(remaining, TimeUnit.NANOSECONDS));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("⚠️ Scoring failed for {}: {}", ticker, cause.getMessage());
                    failures.add(new ScoringFailure(ticker, describe(cause)));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("⏱️ Scoring timed out for {}", ticker);
                    failures.add(new ScoringFailure(ticker, "Timed out after " + config.getBatchTimeoutSeconds() + "s"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    failures.add(new ScoringFailure(ticker, "Interrupted"));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        outputs.sort(Comparator.comparing(ScoreOutput::ticker));
        log.info("✅ Batch {} {}: {} scored, {} failed in {}ms", date, mode.getCode(),
                outputs.size(), failures.size(), System.currentTimeMillis() - started);
        return new BatchScoreResult(date, mode, universe.size(), outputs, sortFailures(failures));
    }

    private List<InstrumentSnapshot> validOnly(List<InstrumentSnapshot> universe, ScoringMode mode, LocalDate date,
                                               List<ScoringFailure> failures) {
        List<InstrumentSnapshot> valid = new ArrayList<>(universe.size());
        Set<String> seen = new HashSet<>();
        for (InstrumentSnapshot snapshot : universe) {
            try {
                validator.validate(snapshot, mode, date);
                if (!seen.add(snapshot.getTicker())) {
                    throw new InvalidScoringInputException("Duplicate snapshot for " + snapshot.getTicker());
                }
                valid.add(snapshot);
            } catch (IllegalArgumentException e) {
                String ticker = snapshot == null ? null : snapshot.getTicker();
                log.warn("⚠️ Skipping {}: {}", ticker, e.getMessage());
                failures.add(new ScoringFailure(ticker, e.getMessage()));
            }
        }
        return valid;
    }

    private static List<ScoringFailure> sortFailures(List<ScoringFailure> failures) {
        List<ScoringFailure> sorted = new ArrayList<>(failures);
        sorted.sort(Comparator.comparing(ScoringFailure::ticker, Comparator.nullsFirst(Comparator.naturalOrder())));
        return sorted;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
