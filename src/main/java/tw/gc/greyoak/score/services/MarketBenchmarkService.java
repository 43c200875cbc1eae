package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Horizon;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PeerSet;
import tw.gc.greyoak.score.model.SectorAggregate;
import tw.gc.greyoak.score.model.SectorMomentumReading;
import tw.gc.greyoak.score.normalization.NormalizationEngine;
import tw.gc.greyoak.score.pillars.RelativeStrengthPillar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * MarketBenchmarkService
 *
 * Builds the per-date aggregates every instrument is compared against: equal-weighted
 * market and sector returns, sector volatility, the cross-sector S_z table and the
 * universe distribution of relative-strength alphas. Built once per (date, universe)
 * and shared read-only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketBenchmarkService {

    private final ScoringConfig config;
    private final RelativeStrengthPillar relativeStrengthPillar;

    /**
     * Sector peer sets keyed by sector group, members in universe order
     */
    public Map<String, PeerSet> peerSets(LocalDate asOfDate, List<InstrumentSnapshot> universe) {
        Map<String, List<InstrumentSnapshot>> grouped = new TreeMap<>();
        for (InstrumentSnapshot snapshot : universe) {
            grouped.computeIfAbsent(snapshot.getSectorGroup(), k -> new ArrayList<>()).add(snapshot);
        }
        Map<String, PeerSet> peerSets = new TreeMap<>();
        grouped.forEach((sector, members) -> peerSets.put(sector, new PeerSet(sector, asOfDate, members)));
        return peerSets;
    }

    public MarketBenchmark build(LocalDate asOfDate, List<InstrumentSnapshot> universe) {
        Map<Horizon, Double> marketReturns = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            List<Double> returns = new ArrayList<>();
            for (InstrumentSnapshot snapshot : universe) {
                addFinite(returns, horizon.returnOf(snapshot.getPrices()));
            }
            // nobody reported: excess returns are measured against zero
            marketReturns.put(horizon, returns.isEmpty() ? 0.0 : NormalizationEngine.mean(returns));
        }

        Map<String, SectorAggregate> sectors = new TreeMap<>();
        peerSets(asOfDate, universe).forEach((sector, peers) -> sectors.put(sector, aggregate(peers)));

        Map<String, SectorMomentumReading> momentum = sectorMomentum(sectors, marketReturns);

        MarketBenchmark partial = new MarketBenchmark(asOfDate, marketReturns, sectors, momentum, List.of());
        List<Double> alphas = new ArrayList<>(universe.size());
        for (InstrumentSnapshot snapshot : universe) {
            alphas.add(relativeStrengthPillar.weightedAlpha(
                    snapshot.getPrices(), snapshot.getSectorGroup(), partial, config).weightedAlpha());
        }
        alphas.sort(Double::compare);

        log.info("📊 Benchmark {}: {} instruments, {} sectors", asOfDate, universe.size(), sectors.size());
        return new MarketBenchmark(asOfDate, marketReturns, sectors, momentum, alphas);
    }

    private SectorAggregate aggregate(PeerSet peers) {
        Map<Horizon, Double> averages = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            List<Double> returns = peers.values(s -> horizon.returnOf(s.getPrices()));
            if (!returns.isEmpty()) {
                averages.put(horizon, NormalizationEngine.mean(returns));
            }
        }
        List<Double> sigmas = peers.values(s -> s.getPrices().getSigma20());
        Double averageSigma = sigmas.isEmpty() ? null : NormalizationEngine.mean(sigmas);
        return new SectorAggregate(peers.sectorGroup(), peers.size(), averages, averageSigma);
    }

    /**
     * Cross-sector z of each sector's excess return per horizon, blended into S_z.
     * Fewer than two sectors, or no dispersion on a horizon, gives z = 0.
     */
    Map<String, SectorMomentumReading> sectorMomentum(Map<String, SectorAggregate> sectors,
                                                      Map<Horizon, Double> marketReturns) {
        Map<String, SectorMomentumReading> readings = new TreeMap<>();
        if (sectors.size() < 2) {
            sectors.keySet().forEach(sector -> readings.put(sector, SectorMomentumReading.neutral(sector)));
            if (!sectors.isEmpty()) {
                log.info("📉 Single sector universe: S_z is 0 for every instrument");
            }
            return readings;
        }

        Map<String, Map<Horizon, Double>> zBySector = new TreeMap<>();
        sectors.keySet().forEach(sector -> zBySector.put(sector, new EnumMap<>(Horizon.class)));

        for (Horizon horizon : Horizon.values()) {
            Map<String, Double> excess = new TreeMap<>();
            sectors.forEach((sector, aggregate) -> {
                Double average = aggregate.averageReturn(horizon);
                if (average != null) {
                    excess.put(sector, average - marketReturns.get(horizon));
                }
            });
            List<Double> values = new ArrayList<>(excess.values());
            double mean = NormalizationEngine.mean(values);
            double std = NormalizationEngine.sampleStdDev(values, mean);
            boolean dispersed = values.size() >= 2 && Double.isFinite(std) && std > AppConstants.TINY;
            for (String sector : sectors.keySet()) {
                Double value = excess.get(sector);
                double z = dispersed && value != null ? (value - mean) / std : 0.0;
                zBySector.get(sector).put(horizon, z);
            }
        }

        zBySector.forEach((sector, horizonZ) -> {
            double sZ = 0.0;
            for (Map.Entry<Horizon, Double> entry : horizonZ.entrySet()) {
                sZ += config.getSectorMomentumHorizons().weightOf(entry.getKey()) * entry.getValue();
            }
            readings.put(sector, new SectorMomentumReading(sector, horizonZ, sZ));
            log.debug("Sector {} S_z={}", sector, sZ);
        });
        return readings;
    }

    private static void addFinite(List<Double> values, Double value) {
        if (value != null && Double.isFinite(value)) {
            values.add(value);
        }
    }
}
