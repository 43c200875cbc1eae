package tw.gc.greyoak.score.controllers;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.SnapshotNotFoundException;
import tw.gc.greyoak.score.model.BatchScoreResult;
import tw.gc.greyoak.score.model.ScoreExplanation;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.services.BatchScoringService;
import tw.gc.greyoak.score.services.ScoreExplanationService;
import tw.gc.greyoak.score.services.ScorePersistenceService;
import tw.gc.greyoak.score.services.ScoringInputValidator;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Score Controller
 * Scoring requests and lookups of stored scores.
 *
 * Modes are accepted as "Trader"/"Investor" (case-insensitive), bands as
 * "Strong Buy" or STRONG_BUY.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ScoreController {

    private final BatchScoringService batchScoringService;
    private final ScorePersistenceService persistenceService;
    private final ScoreExplanationService explanationService;
    private final ScoringInputValidator validator;
    private final ScoringConfig config;

    @PostMapping("/score")
    public ScoreOutput score(@Valid @RequestBody ScoreRequest request) {
        ScoringMode mode = ScoringMode.fromCode(request.mode());
        log.info("📥 Score request {} {} {}", request.ticker(), request.date(), mode.getCode());
        ScoreOutput output = batchScoringService.scoreTicker(request.ticker(), request.date(), mode);
        persistenceService.save(output);
        return output.withoutDiagnostics();
    }

    @PostMapping("/score/batch")
    public BatchScoreResult scoreBatch(@Valid @RequestBody BatchRequest request) {
        ScoringMode mode = ScoringMode.fromCode(request.mode());
        log.info("📥 Batch request {} {}", request.date(), mode.getCode());
        BatchScoreResult result = batchScoringService.scoreDate(request.date(), mode);
        persistenceService.saveAll(result.outputs());
        return new BatchScoreResult(result.date(), result.mode(), result.universeSize(),
                result.outputs().stream().map(ScoreOutput::withoutDiagnostics).toList(), result.failures());
    }

    @GetMapping("/scores/latest")
    public List<ScoreOutput> latest(@RequestParam(required = false) String mode) {
        return persistenceService.findLatest(parseMode(mode));
    }

    @GetMapping("/scores/band/{band}")
    public List<ScoreOutput> byBand(@PathVariable String band,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                    @RequestParam(required = false) String mode) {
        return persistenceService.findByBand(Band.fromLabel(band), date, parseMode(mode));
    }

    @GetMapping("/scores/{ticker}")
    public List<ScoreOutput> history(@PathVariable String ticker,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
                                     @RequestParam(required = false) String mode) {
        validator.validateTicker(ticker);
        return persistenceService.findHistory(ticker, start, end, parseMode(mode));
    }

    @GetMapping("/score/{ticker}/{date}/{mode}/explain")
    public ScoreExplanation explain(@PathVariable String ticker,
                                    @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                    @PathVariable String mode) {
        validator.validateTicker(ticker);
        ScoringMode scoringMode = ScoringMode.fromCode(mode);
        ScoreOutput output = persistenceService.find(ticker, date, scoringMode)
                .orElseThrow(() -> new SnapshotNotFoundException(
                        "No stored " + scoringMode.getCode() + " score for " + ticker + " on " + date));
        return explanationService.explain(output);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "UP",
                "configHash", config.getHash(),
                "codeVersion", config.getCodeVersion());
    }

    private static ScoringMode parseMode(String mode) {
        return mode == null || mode.isBlank() ? null : ScoringMode.fromCode(mode);
    }

    public record ScoreRequest(@NotBlank String ticker, @NotNull LocalDate date, @NotBlank String mode) {
    }

    public record BatchRequest(@NotNull LocalDate date, @NotBlank String mode) {
    }
}
