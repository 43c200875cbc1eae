package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.ScoringMode;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of scoring a universe: outputs sorted by ticker plus per-instrument failures.
 */
public record BatchScoreResult(LocalDate date,
                               ScoringMode mode,
                               int universeSize,
                               List<ScoreOutput> outputs,
                               List<ScoringFailure> failures) {

    public BatchScoreResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int scoredCount() {
        return outputs.size();
    }

    public int failedCount() {
        return failures.size();
    }
}
