package tw.gc.greyoak.score.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.greyoak.score.entities.ScoreRecord;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.ScoringMode;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScoreRecordRepository extends JpaRepository<ScoreRecord, Long> {

    Optional<ScoreRecord> findByTickerAndScoreDateAndMode(String ticker, LocalDate scoreDate, ScoringMode mode);

    // ========== History ==========

    List<ScoreRecord> findByTickerAndScoreDateBetweenOrderByScoreDateDescModeAsc(
            String ticker, LocalDate startDate, LocalDate endDate);

    List<ScoreRecord> findByTickerAndModeAndScoreDateBetweenOrderByScoreDateDesc(
            String ticker, ScoringMode mode, LocalDate startDate, LocalDate endDate);

    // ========== Band screens ==========

    List<ScoreRecord> findByBandAndScoreDateOrderByScoreDesc(Band band, LocalDate scoreDate);

    List<ScoreRecord> findByBandAndScoreDateAndModeOrderByScoreDesc(Band band, LocalDate scoreDate, ScoringMode mode);

    // ========== Latest ==========

    /**
     * Most recent score per ticker across modes: latest date, then latest computation
     */
    @Query("""
            SELECT s FROM ScoreRecord s
            WHERE NOT EXISTS (
                SELECT s2.id FROM ScoreRecord s2
                WHERE s2.ticker = s.ticker
                AND (s2.scoreDate > s.scoreDate
                    OR (s2.scoreDate = s.scoreDate AND s2.asOf > s.asOf)
                    OR (s2.scoreDate = s.scoreDate AND s2.asOf = s.asOf AND s2.id > s.id))
            )
            ORDER BY s.ticker
            """)
    List<ScoreRecord> findLatestPerTicker();

    /**
     * Most recent score per ticker within one mode
     */
    @Query("""
            SELECT s FROM ScoreRecord s
            WHERE s.mode = :mode
            AND s.scoreDate = (
                SELECT MAX(s2.scoreDate) FROM ScoreRecord s2
                WHERE s2.ticker = s.ticker AND s2.mode = :mode
            )
            ORDER BY s.ticker
            """)
    List<ScoreRecord> findLatestPerTickerByMode(@Param("mode") ScoringMode mode);
}
