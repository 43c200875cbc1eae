package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.ScoringMode;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Human-readable breakdown of a score output.
 */
public record ScoreExplanation(String ticker,
                               LocalDate date,
                               ScoringMode mode,
                               double score,
                               Band band,
                               String summary,
                               Map<String, String> pillars,
                               String riskPenalty,
                               List<String> guardrails,
                               String dataQuality,
                               String sectorMomentum) {
}
