package tw.gc.greyoak.score.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import tw.gc.greyoak.score.entities.ScoreRecord;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.repositories.ScoreRecordRepository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScorePersistenceService")
class ScorePersistenceServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 14);

    @Mock
    private ScoreRecordRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus transactionStatus;

    private ScorePersistenceService service;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        service = new ScorePersistenceService(repository, transactionManager);
    }

    private static ScoreOutput output(double score) {
        Map<Pillar, Double> pillars = new EnumMap<>(Pillar.class);
        pillars.put(Pillar.F, 70.0);
        pillars.put(Pillar.T, 60.0);
        pillars.put(Pillar.R, 55.0);
        pillars.put(Pillar.O, 80.0);
        pillars.put(Pillar.Q, 90.0);
        pillars.put(Pillar.S, 50.0);
        return ScoreOutput.builder()
                .ticker("TCS.NS")
                .date(DATE)
                .mode(ScoringMode.TRADER)
                .score(score)
                .band(Band.HOLD)
                .pillars(pillars)
                .riskPenalty(4.0)
                .confidence(0.909)
                .sZ(-0.25)
                .guardrailFlags(List.of(GuardrailFlag.PLEDGE_CAP))
                .asOf(OffsetDateTime.of(2024, 6, 14, 18, 0, 0, 0, ZoneOffset.ofHoursMinutes(5, 30)))
                .configHash("abc123")
                .codeVersion("1.0.0")
                .build();
    }

    @Nested
    @DisplayName("Saving")
    class Saving {

        @Test
        @DisplayName("should insert a new record with every field")
        void shouldInsertNewRecord() {
            when(repository.findByTickerAndScoreDateAndMode("TCS.NS", DATE, ScoringMode.TRADER))
                    .thenReturn(Optional.empty());
            when(repository.saveAndFlush(any(ScoreRecord.class))).thenAnswer(inv -> inv.getArgument(0));

            service.save(output(62.5));

            ArgumentCaptor<ScoreRecord> captor = ArgumentCaptor.forClass(ScoreRecord.class);
            verify(repository).saveAndFlush(captor.capture());
            ScoreRecord saved = captor.getValue();
            assertThat(saved.getId()).isNull();
            assertThat(saved.getScore()).isEqualTo(62.5);
            assertThat(saved.getQuality()).isEqualTo(90.0);
            assertThat(saved.getSZ()).isEqualTo(-0.25);
            assertThat(saved.getGuardrailFlags()).containsExactly(GuardrailFlag.PLEDGE_CAP);
            assertThat(saved.getConfigHash()).isEqualTo("abc123");
        }

        @Test
        @DisplayName("should overwrite the record for the same ticker, date and mode")
        void shouldOverwriteExisting() {
            ScoreRecord existing = ScoreRecord.builder().id(7L).ticker("TCS.NS").scoreDate(DATE)
                    .mode(ScoringMode.TRADER).score(40.0).band(Band.AVOID).build();
            when(repository.findByTickerAndScoreDateAndMode("TCS.NS", DATE, ScoringMode.TRADER))
                    .thenReturn(Optional.of(existing));
            when(repository.saveAndFlush(any(ScoreRecord.class))).thenAnswer(inv -> inv.getArgument(0));

            ScoreRecord saved = service.save(output(62.5));

            assertThat(saved.getId()).isEqualTo(7L);
            assertThat(saved.getScore()).isEqualTo(62.5);
            assertThat(saved.getBand()).isEqualTo(Band.HOLD);
        }

        @Test
        @DisplayName("should overwrite the row a concurrent writer inserted first")
        void shouldRetryAsOverwriteAfterUniqueKeyClash() {
            ScoreRecord concurrent = ScoreRecord.builder().id(9L).ticker("TCS.NS").scoreDate(DATE)
                    .mode(ScoringMode.TRADER).score(40.0).band(Band.AVOID).build();
            when(repository.findByTickerAndScoreDateAndMode("TCS.NS", DATE, ScoringMode.TRADER))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(concurrent));
            when(repository.saveAndFlush(any(ScoreRecord.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_scores_ticker_date_mode"))
                    .thenAnswer(inv -> inv.getArgument(0));

            ScoreRecord saved = service.save(output(62.5));

            assertThat(saved.getId()).isEqualTo(9L);
            assertThat(saved.getScore()).isEqualTo(62.5);
            verify(repository, times(2)).saveAndFlush(any(ScoreRecord.class));
            verify(transactionManager).rollback(transactionStatus);
            verify(transactionManager).commit(transactionStatus);
        }

        @Test
        @DisplayName("should give up after a second unique-key clash")
        void shouldPropagateRepeatedClash() {
            when(repository.findByTickerAndScoreDateAndMode("TCS.NS", DATE, ScoringMode.TRADER))
                    .thenReturn(Optional.empty());
            when(repository.saveAndFlush(any(ScoreRecord.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_scores_ticker_date_mode"));

            assertThatThrownBy(() -> service.save(output(62.5)))
                    .isInstanceOf(DataIntegrityViolationException.class);
            verify(repository, times(2)).saveAndFlush(any(ScoreRecord.class));
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("should map a stored record back to an output")
        void shouldMapRecordToOutput() {
            ScoreRecord record = new ScoreRecord();
            ScorePersistenceService.apply(record, output(71.0));
            when(repository.findByTickerAndScoreDateAndMode("TCS.NS", DATE, ScoringMode.TRADER))
                    .thenReturn(Optional.of(record));

            ScoreOutput found = service.find("TCS.NS", DATE, ScoringMode.TRADER).orElseThrow();

            assertThat(found.withoutDiagnostics()).isEqualTo(output(71.0));
            assertThat(found.diagnostics()).isNull();
        }

        @Test
        @DisplayName("should reject an inverted history range")
        void shouldRejectInvertedRange() {
            assertThatThrownBy(() -> service.findHistory("TCS.NS", DATE, DATE.minusDays(1), null))
                    .isInstanceOf(InvalidScoringInputException.class);
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("should query across modes when no mode is given")
        void shouldQueryAcrossModes() {
            when(repository.findByTickerAndScoreDateBetweenOrderByScoreDateDescModeAsc(
                    "TCS.NS", LocalDate.of(1900, 1, 1), DATE)).thenReturn(List.of());

            assertThat(service.findHistory("TCS.NS", null, DATE, null)).isEmpty();
            verify(repository, never()).findByTickerAndModeAndScoreDateBetweenOrderByScoreDateDesc(
                    any(), any(), any(), any());
        }

        @Test
        @DisplayName("should filter latest scores by mode")
        void shouldFilterLatestByMode() {
            ScoreRecord record = new ScoreRecord();
            ScorePersistenceService.apply(record, output(80.0));
            when(repository.findLatestPerTickerByMode(ScoringMode.TRADER)).thenReturn(List.of(record));

            assertThat(service.findLatest(ScoringMode.TRADER)).extracting(ScoreOutput::score).containsExactly(80.0);
        }
    }
}
