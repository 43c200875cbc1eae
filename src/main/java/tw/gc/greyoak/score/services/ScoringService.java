package tw.gc.greyoak.score.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.ScoringConfigurationException;
import tw.gc.greyoak.score.guardrails.GuardrailEngine;
import tw.gc.greyoak.score.guardrails.GuardrailInput;
import tw.gc.greyoak.score.guardrails.GuardrailState;
import tw.gc.greyoak.score.model.DataQuality;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PeerSet;
import tw.gc.greyoak.score.model.PillarScore;
import tw.gc.greyoak.score.model.PillarWeights;
import tw.gc.greyoak.score.model.RiskPenaltyResult;
import tw.gc.greyoak.score.model.ScoreDiagnostics;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.normalization.NormalizationEngine;
import tw.gc.greyoak.score.pillars.PillarCalculator;
import tw.gc.greyoak.score.pillars.PillarContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ScoringService
 *
 * Scores one instrument: validate, six pillars, weighted sum, risk penalty,
 * pre-guardrail score, confidence, guardrails, rounded output.
 * Pure apart from logging and the asOf timestamp; safe to call concurrently.
 */
@Service
@Slf4j
public class ScoringService {

    private final ScoringConfig config;
    private final Map<Pillar, PillarCalculator> calculators;
    private final RiskPenaltyCalculator riskPenaltyCalculator;
    private final GuardrailEngine guardrailEngine;
    private final ScoringInputValidator validator;
    private final DataQualityAssessor dataQualityAssessor;

    public ScoringService(ScoringConfig config,
                          List<PillarCalculator> pillarCalculators,
                          RiskPenaltyCalculator riskPenaltyCalculator,
                          GuardrailEngine guardrailEngine,
                          ScoringInputValidator validator,
                          DataQualityAssessor dataQualityAssessor) {
        this.config = config;
        this.riskPenaltyCalculator = riskPenaltyCalculator;
        this.guardrailEngine = guardrailEngine;
        this.validator = validator;
        this.dataQualityAssessor = dataQualityAssessor;

        EnumMap<Pillar, PillarCalculator> byPillar = new EnumMap<>(Pillar.class);
        for (PillarCalculator calculator : pillarCalculators) {
            if (byPillar.put(calculator.pillar(), calculator) != null) {
                throw new ScoringConfigurationException("Duplicate calculator for pillar " + calculator.pillar());
            }
        }
        for (Pillar pillar : Pillar.values()) {
            if (!byPillar.containsKey(pillar)) {
                throw new ScoringConfigurationException("No calculator for pillar " + pillar);
            }
        }
        this.calculators = byPillar;
    }

    public ScoreOutput computeScore(InstrumentSnapshot snapshot, PeerSet peerSet, MarketBenchmark benchmark,
                                    PillarWeights weights, ScoringMode mode, LocalDate asOfDate) {
        validator.validate(snapshot, mode, asOfDate);
        validator.validateContext(snapshot, peerSet, benchmark, weights, asOfDate);

        PillarContext context = new PillarContext(snapshot, peerSet, benchmark, config);
        EnumMap<Pillar, Double> pillarScores = new EnumMap<>(Pillar.class);
        EnumMap<Pillar, Map<String, Object>> pillarDetails = new EnumMap<>(Pillar.class);
        for (Map.Entry<Pillar, PillarCalculator> entry : calculators.entrySet()) {
            PillarScore score = entry.getValue().calculate(context);
            pillarScores.put(entry.getKey(), score.score());
            pillarDetails.put(entry.getKey(), score.details());
        }

        double weighted = NormalizationEngine.clampPoints(weights.combine(pillarScores));
        RiskPenaltyResult risk = riskPenaltyCalculator.calculate(snapshot, mode, benchmark, asOfDate);
        double preGuard = Math.max(0.0, weighted - risk.total());
        DataQuality quality = dataQualityAssessor.assess(snapshot);
        double sZ = benchmark.sectorZ(snapshot.getSectorGroup());
        Double mtv = snapshot.getPrices().resolvedMedianTradedValueCr();

        GuardrailState state = guardrailEngine.apply(GuardrailInput.builder()
                .scorePreGuard(preGuard)
                .confidence(quality.confidence())
                .imputedFraction(quality.imputedFraction())
                .sZ(sZ)
                .riskPenalty(risk.total())
                .mode(mode)
                .medianTradedValueCr(mtv)
                .pledgeFraction(snapshot.getOwnership().getPromoterPledgeFrac())
                .build());

        EnumMap<Pillar, Double> roundedPillars = new EnumMap<>(Pillar.class);
        pillarScores.forEach((pillar, value) -> roundedPillars.put(pillar, round(value, 2)));
        Band preGuardBand = config.getBands().bandFor(preGuard);

        ScoreOutput output = ScoreOutput.builder()
                .ticker(snapshot.getTicker())
                .date(asOfDate)
                .mode(mode)
                .score(round(state.score(), 2))
                .band(state.band())
                .pillars(roundedPillars)
                .riskPenalty(round(risk.total(), 2))
                .confidence(round(quality.confidence(), 3))
                .sZ(round(sZ, 3))
                .guardrailFlags(state.flags())
                .asOf(OffsetDateTime.now(AppConstants.MARKET_ZONE))
                .configHash(config.getHash())
                .codeVersion(config.getCodeVersion())
                .diagnostics(ScoreDiagnostics.builder()
                        .weights(weights)
                        .pillarDetails(pillarDetails)
                        .riskBreakdown(risk.breakdown())
                        .dataQuality(quality)
                        .weightedScore(weighted)
                        .preGuardrailScore(preGuard)
                        .preGuardrailBand(preGuardBand)
                        .medianTradedValueCr(mtv)
                        .build())
                .build();

        log.info("🎯 {} {} {}: score={} band={} (pre-guard {} {}), RP={}, confidence={}",
                snapshot.getTicker(), asOfDate, mode.getCode(), output.score(), output.band().getLabel(),
                round(preGuard, 2), preGuardBand.getLabel(), output.riskPenalty(), output.confidence());
        return output;
    }

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
