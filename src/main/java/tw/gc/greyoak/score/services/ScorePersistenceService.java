package tw.gc.greyoak.score.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.greyoak.score.entities.ScoreRecord;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.repositories.ScoreRecordRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

/**
 * ScorePersistenceService
 *
 * Stores score outputs keyed on (ticker, date, mode). Saving an existing triple
 * overwrites it, so re-running a date is idempotent.
 *
 * Each save commits in its own transaction. When two writers race on a new
 * triple, the loser sees the unique-key violation and retries once as an overwrite.
 */
@Service
@Slf4j
public class ScorePersistenceService {

    private final ScoreRecordRepository repository;
    private final TransactionTemplate writeTemplate;

    public ScorePersistenceService(ScoreRecordRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public ScoreRecord save(ScoreOutput output) {
        try {
            return writeTemplate.execute(status -> upsert(output));
        } catch (DataIntegrityViolationException e) {
            log.debug("🔁 Concurrent insert for {} {} {}, retrying as overwrite",
                    output.ticker(), output.date(), output.mode().getCode());
            return writeTemplate.execute(status -> upsert(output));
        }
    }

    /**
     * Saves every output; a failure on one output propagates, earlier ones stay committed
     */
    public int saveAll(List<ScoreOutput> outputs) {
        for (ScoreOutput output : outputs) {
            save(output);
        }
        log.info("💾 Persisted {} scores", outputs.size());
        return outputs.size();
    }

    private ScoreRecord upsert(ScoreOutput output) {
        ScoreRecord record = repository
                .findByTickerAndScoreDateAndMode(output.ticker(), output.date(), output.mode())
                .orElseGet(ScoreRecord::new);
        boolean overwrite = record.getId() != null;
        apply(record, output);
        // flush inside the transaction so a unique-key clash surfaces here
        ScoreRecord saved = repository.saveAndFlush(record);
        log.debug("💾 {} score {} {} {}", overwrite ? "Overwrote" : "Saved",
                output.ticker(), output.date(), output.mode().getCode());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<ScoreOutput> find(String ticker, LocalDate date, ScoringMode mode) {
        return repository.findByTickerAndScoreDateAndMode(ticker, date, mode).map(ScorePersistenceService::toOutput);
    }

    /**
     * History for a ticker, newest first; mode is optional
     */
    @Transactional(readOnly = true)
    public List<ScoreOutput> findHistory(String ticker, LocalDate start, LocalDate end, ScoringMode mode) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidScoringInputException("start " + start + " is after end " + end);
        }
        LocalDate from = start != null ? start : LocalDate.of(1900, 1, 1);
        LocalDate to = end != null ? end : LocalDate.of(9999, 12, 31);
        List<ScoreRecord> records = mode == null
                ? repository.findByTickerAndScoreDateBetweenOrderByScoreDateDescModeAsc(ticker, from, to)
                : repository.findByTickerAndModeAndScoreDateBetweenOrderByScoreDateDesc(ticker, mode, from, to);
        return toOutputs(records);
    }

    @Transactional(readOnly = true)
    public List<ScoreOutput> findByBand(Band band, LocalDate date, ScoringMode mode) {
        List<ScoreRecord> records = mode == null
                ? repository.findByBandAndScoreDateOrderByScoreDesc(band, date)
                : repository.findByBandAndScoreDateAndModeOrderByScoreDesc(band, date, mode);
        return toOutputs(records);
    }

    @Transactional(readOnly = true)
    public List<ScoreOutput> findLatest(ScoringMode mode) {
        List<ScoreRecord> records = mode == null
                ? repository.findLatestPerTicker()
                : repository.findLatestPerTickerByMode(mode);
        return toOutputs(records);
    }

    static void apply(ScoreRecord record, ScoreOutput output) {
        record.setTicker(output.ticker());
        record.setScoreDate(output.date());
        record.setMode(output.mode());
        record.setScore(output.score());
        record.setBand(output.band());
        record.setFundamentals(output.pillars().getOrDefault(Pillar.F, 0.0));
        record.setTechnicals(output.pillars().getOrDefault(Pillar.T, 0.0));
        record.setRelativeStrength(output.pillars().getOrDefault(Pillar.R, 0.0));
        record.setOwnership(output.pillars().getOrDefault(Pillar.O, 0.0));
        record.setQuality(output.pillars().getOrDefault(Pillar.Q, 0.0));
        record.setSectorMomentum(output.pillars().getOrDefault(Pillar.S, 0.0));
        record.setRiskPenalty(output.riskPenalty());
        record.setConfidence(output.confidence());
        record.setSZ(output.sZ());
        record.setGuardrailFlags(new ArrayList<>(output.guardrailFlags()));
        record.setAsOf(output.asOf());
        record.setConfigHash(output.configHash());
        record.setCodeVersion(output.codeVersion());
    }

    static ScoreOutput toOutput(ScoreRecord record) {
        EnumMap<Pillar, Double> pillars = new EnumMap<>(Pillar.class);
        pillars.put(Pillar.F, record.getFundamentals());
        pillars.put(Pillar.T, record.getTechnicals());
        pillars.put(Pillar.R, record.getRelativeStrength());
        pillars.put(Pillar.O, record.getOwnership());
        pillars.put(Pillar.Q, record.getQuality());
        pillars.put(Pillar.S, record.getSectorMomentum());
        return ScoreOutput.builder()
                .ticker(record.getTicker())
                .date(record.getScoreDate())
                .mode(record.getMode())
                .score(record.getScore())
                .band(record.getBand())
                .pillars(pillars)
                .riskPenalty(record.getRiskPenalty())
                .confidence(record.getConfidence())
                .sZ(record.getSZ())
                .guardrailFlags(record.getGuardrailFlags())
                .asOf(record.getAsOf())
                .configHash(record.getConfigHash())
                .codeVersion(record.getCodeVersion())
                .build();
    }

    private static List<ScoreOutput> toOutputs(List<ScoreRecord> records) {
        return records.stream().map(ScorePersistenceService::toOutput).toList();
    }
}
