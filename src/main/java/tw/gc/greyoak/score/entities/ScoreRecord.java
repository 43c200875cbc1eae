package tw.gc.greyoak.score.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;
import tw.gc.greyoak.score.enums.ScoringMode;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * ScoreRecord Entity - one stored score per (ticker, score_date, mode).
 *
 * Re-scoring the same triple overwrites the row in place.
 *
 * @see tw.gc.greyoak.score.services.ScorePersistenceService
 */
@Entity
@Table(name = "scores",
        uniqueConstraints = @UniqueConstraint(name = "uk_scores_ticker_date_mode",
                columnNames = {"ticker", "score_date", "score_mode"}),
        indexes = {
                @Index(name = "idx_scores_ticker_date", columnList = "ticker, score_date"),
                @Index(name = "idx_scores_band_date", columnList = "band, score_date"),
                @Index(name = "idx_scores_date", columnList = "score_date")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 20, nullable = false)
    private String ticker;

    @Column(name = "score_date", nullable = false)
    private LocalDate scoreDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "score_mode", length = 10, nullable = false)
    private ScoringMode mode;

    @Column(nullable = false)
    private double score;

    @Enumerated(EnumType.STRING)
    @Column(length = 12, nullable = false)
    private Band band;

    // ========== Pillars ==========

    @Column(name = "f_pillar", nullable = false)
    private double fundamentals;

    @Column(name = "t_pillar", nullable = false)
    private double technicals;

    @Column(name = "r_pillar", nullable = false)
    private double relativeStrength;

    @Column(name = "o_pillar", nullable = false)
    private double ownership;

    @Column(name = "q_pillar", nullable = false)
    private double quality;

    @Column(name = "s_pillar", nullable = false)
    private double sectorMomentum;

    // ========== Risk & Guardrails ==========

    @Column(name = "risk_penalty", nullable = false)
    private double riskPenalty;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "s_z", nullable = false)
    private double sZ;

    @Convert(converter = GuardrailFlagsConverter.class)
    @Column(name = "guardrail_flags", length = 200)
    @Builder.Default
    private List<GuardrailFlag> guardrailFlags = new ArrayList<>();

    // ========== Audit ==========

    @Column(name = "as_of", nullable = false)
    private OffsetDateTime asOf;

    @Column(name = "config_hash", length = 64, nullable = false)
    private String configHash;

    @Column(name = "code_version", length = 20, nullable = false)
    private String codeVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
