package tw.gc.greyoak.score.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.enums.ScoringMode;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final, rounded result of scoring one instrument on one date in one mode.
 * (ticker, date, mode) identifies a stored output.
 *
 * @param diagnostics in-memory breakdown; null for outputs read back from storage
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreOutput(String ticker,
                          LocalDate date,
                          ScoringMode mode,
                          double score,
                          Band band,
                          Map<Pillar, Double> pillars,
                          double riskPenalty,
                          double confidence,
                          double sZ,
                          List<GuardrailFlag> guardrailFlags,
                          OffsetDateTime asOf,
                          String configHash,
                          String codeVersion,
                          ScoreDiagnostics diagnostics) {

    public ScoreOutput {
        pillars = pillars == null || pillars.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(pillars));
        guardrailFlags = guardrailFlags == null ? List.of() : List.copyOf(guardrailFlags);
    }

    public ScoreOutput withoutDiagnostics() {
        return toBuilder().diagnostics(null).build();
    }
}
