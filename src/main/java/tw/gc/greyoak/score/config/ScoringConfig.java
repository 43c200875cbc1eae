package tw.gc.greyoak.score.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Getter;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.ScoringConfigurationException;
import tw.gc.greyoak.score.model.PillarWeights;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * ScoringConfig
 *
 * Immutable, validated snapshot of {@link ScoringProperties}. Identified by the SHA-256 of its
 * canonical JSON form (keys sorted), which is stamped on every score for audit reproducibility.
 * Operational settings (data directory, batch timeout) are left out of the hash since they
 * cannot change a score.
 */
@Getter
public final class ScoringConfig {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final Set<String> OPERATIONAL_KEYS = Set.of("dataDir", "batchTimeoutSeconds");

    private final String codeVersion;
    private final String dataDir;
    private final int batchTimeoutSeconds;
    private final Set<String> sectorGroups;
    private final Set<String> bankingSectors;
    private final Map<ScoringMode, Map<String, PillarWeights>> pillarWeights;
    private final Map<String, Double> riskCaps;
    private final Map<ScoringMode, List<PenaltyBin>> liquidityBins;
    private final BandThresholds bands;
    private final GuardrailThresholds guardrails;
    private final RiskPenaltyParams riskPenalty;
    private final TechnicalParams technicals;
    private final HorizonBlend relativeStrengthHorizons;
    private final double sectorBlend;
    private final double marketBlend;
    private final HorizonBlend sectorMomentumHorizons;
    private final Map<String, Double> standardFundamentalWeights;
    private final Map<String, Double> bankingFundamentalWeights;
    private final String hash;

    private ScoringConfig(ScoringProperties p, String hash) {
        this.codeVersion = p.getCodeVersion();
        this.dataDir = p.getDataDir();
        this.batchTimeoutSeconds = p.getBatchTimeoutSeconds();
        this.sectorGroups = Collections.unmodifiableSet(new LinkedHashSet<>(p.getSectorGroups()));
        this.bankingSectors = Collections.unmodifiableSet(new LinkedHashSet<>(p.getBankingSectors()));

        EnumMap<ScoringMode, Map<String, PillarWeights>> weights = new EnumMap<>(ScoringMode.class);
        EnumMap<ScoringMode, List<PenaltyBin>> liquidity = new EnumMap<>(ScoringMode.class);
        for (ScoringMode mode : ScoringMode.values()) {
            Map<String, PillarWeights> bySector = new TreeMap<>();
            p.getPillarWeights().get(mode.getConfigKey())
                    .forEach((sector, vector) -> bySector.put(sector, PillarWeights.fromMap(vector)));
            weights.put(mode, Collections.unmodifiableMap(bySector));
            liquidity.put(mode, sortedDescending(p.getRiskPenalty().getLiquidity().get(mode.getConfigKey())));
        }
        this.pillarWeights = Collections.unmodifiableMap(weights);
        this.liquidityBins = Collections.unmodifiableMap(liquidity);
        this.riskCaps = Collections.unmodifiableMap(new TreeMap<>(p.getRiskPenalty().getCaps()));

        ScoringProperties.Bands b = p.getBands();
        this.bands = new BandThresholds(b.getStrongBuy(), b.getBuy(), b.getHold());

        ScoringProperties.Guardrails g = p.getGuardrails();
        this.guardrails = new GuardrailThresholds(g.getConfidence(), g.getPledgeCap(), g.getHighRiskRp(),
                g.getSectorBearSz(), g.getSectorBearPenalty(), g.getLowCoverage());

        ScoringProperties.RiskPenalty rp = p.getRiskPenalty();
        this.riskPenalty = RiskPenaltyParams.builder()
                .pledge(sortedDescending(rp.getPledge()))
                .volatilityMultiplier(rp.getVolatilityMultiplier())
                .volatilityPenalty(rp.getVolatilityPenalty())
                .fallbackSectorSigma20(rp.getFallbackSectorSigma20())
                .leverage(sortedDescending(rp.getLeverage()))
                .valuationExtremePe(rp.getValuationExtremePe())
                .valuationExtremePenalty(rp.getValuationExtremePenalty())
                .valuationElevatedPe(rp.getValuationElevatedPe())
                .valuationElevatedPenalty(rp.getValuationElevatedPenalty())
                .negativePePenalty(rp.getNegativePePenalty())
                .thinMarginThreshold(rp.getThinMarginThreshold())
                .thinMarginPenalty(rp.getThinMarginPenalty())
                .negativeMarginPenalty(rp.getNegativeMarginPenalty())
                .resultsLagDays(rp.getResultsLagDays())
                .eventWindowDays(rp.getEventWindowDays())
                .eventPenalty(rp.getEventPenalty())
                .governanceLowRoe(rp.getGovernanceLowRoe())
                .governanceLowRoePenalty(rp.getGovernanceLowRoePenalty())
                .governanceOpmStdev(rp.getGovernanceOpmStdev())
                .governanceOpmStdevPenalty(rp.getGovernanceOpmStdevPenalty())
                .governanceMaxPenalty(rp.getGovernanceMaxPenalty())
                .build();

        ScoringProperties.Technicals t = p.getTechnicals();
        this.technicals = new TechnicalParams(t.getAbove200Weight(), t.getGoldenCrossWeight(), t.getRsiWeight(),
                t.getBreakoutWeight(), t.getVolumeWeight(), t.getRsiLow(), t.getRsiHigh(),
                t.getBreakoutAtrMultiplier(), t.getBreakoutCloseFraction(), t.getVolumeLookback(),
                t.getVolumeRatioLow(), t.getVolumeRatioHigh());

        ScoringProperties.RelativeStrength rs = p.getRelativeStrength();
        this.relativeStrengthHorizons = new HorizonBlend(rs.getOneMonthWeight(), rs.getThreeMonthWeight(), rs.getSixMonthWeight());
        this.sectorBlend = rs.getSectorBlend();
        this.marketBlend = rs.getMarketBlend();

        ScoringProperties.SectorMomentum sm = p.getSectorMomentum();
        this.sectorMomentumHorizons = new HorizonBlend(sm.getOneMonthWeight(), sm.getThreeMonthWeight(), sm.getSixMonthWeight());

        this.standardFundamentalWeights = Map.copyOf(p.getFundamentals().getStandardWeights());
        this.bankingFundamentalWeights = Map.copyOf(p.getFundamentals().getBankingWeights());
        this.hash = hash;
    }

    /**
     * Validate the properties and freeze them.
     *
     * @throws ScoringConfigurationException when the properties are inconsistent
     */
    public static ScoringConfig from(ScoringProperties properties) {
        ScoringConfigValidator.validate(properties);
        return new ScoringConfig(properties, computeHash(properties));
    }

    public static ScoringConfig defaults() {
        return from(new ScoringProperties());
    }

    static String computeHash(ScoringProperties properties) {
        try {
            Map<String, Object> canonical = new HashMap<>(
                    CANONICAL_MAPPER.convertValue(properties, new TypeReference<Map<String, Object>>() { }));
            OPERATIONAL_KEYS.forEach(canonical::remove);
            byte[] json = CANONICAL_MAPPER.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new ScoringConfigurationException("Unable to hash scoring configuration", e);
        }
    }

    public boolean isKnownSector(String sectorGroup) {
        return sectorGroup != null && sectorGroups.contains(sectorGroup);
    }

    public boolean isBankingSector(String sectorGroup) {
        return sectorGroup != null && bankingSectors.contains(sectorGroup);
    }

    /**
     * Sector-specific weights, falling back to the mode default.
     *
     * @throws ScoringConfigurationException for a sector outside the configured groups
     */
    public PillarWeights weightsFor(String sectorGroup, ScoringMode mode) {
        if (!isKnownSector(sectorGroup)) {
            throw new ScoringConfigurationException("Unknown sector group: " + sectorGroup);
        }
        Map<String, PillarWeights> byMode = pillarWeights.get(mode);
        PillarWeights weights = byMode.get(sectorGroup);
        return weights != null ? weights : byMode.get(ScoringProperties.DEFAULT_KEY);
    }

    public double riskCapFor(String sectorGroup) {
        Double cap = riskCaps.get(sectorGroup);
        return cap != null ? cap : riskCaps.get(ScoringProperties.DEFAULT_KEY);
    }

    /**
     * Liquidity bins for a mode, highest threshold first
     */
    public List<PenaltyBin> liquidityBinsFor(ScoringMode mode) {
        return liquidityBins.get(mode);
    }

    /**
     * Median traded value below which a mode treats the instrument as illiquid:
     * the highest liquidity threshold that carries a penalty (trader 2 Cr, investor 1 Cr by default).
     */
    public double illiquidityThreshold(ScoringMode mode) {
        for (PenaltyBin bin : liquidityBinsFor(mode)) {
            if (bin.penalty() > 0.0) {
                return bin.threshold();
            }
        }
        return 0.0;
    }

    private static List<PenaltyBin> sortedDescending(List<ScoringProperties.Bin> bins) {
        List<PenaltyBin> sorted = new ArrayList<>();
        for (ScoringProperties.Bin bin : bins) {
            sorted.add(new PenaltyBin(bin.getThreshold(), bin.getPenalty()));
        }
        sorted.sort(Comparator.comparingDouble(PenaltyBin::threshold).reversed());
        return List.copyOf(sorted);
    }
}
