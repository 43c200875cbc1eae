package tw.gc.greyoak.score.model;

import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.exceptions.ScoringConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pillar weight vector for one (sector group, mode). Always sums to 1.0.
 */
public record PillarWeights(double f, double t, double r, double o, double q, double s) {

    public PillarWeights {
        double sum = f + t + r + o + q + s;
        if (Math.abs(sum - 1.0) > AppConstants.WEIGHT_SUM_TOLERANCE) {
            throw new ScoringConfigurationException("Pillar weights must sum to 1.0, got " + sum);
        }
        for (double w : new double[]{f, t, r, o, q, s}) {
            if (w < 0.0 || !Double.isFinite(w)) {
                throw new ScoringConfigurationException("Pillar weights must be non-negative, got " + w);
            }
        }
    }

    /**
     * Build from a config map keyed by pillar letter (F, T, R, O, Q, S)
     */
    public static PillarWeights fromMap(Map<String, Double> weights) {
        EnumMap<Pillar, Double> byPillar = new EnumMap<>(Pillar.class);
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            try {
                byPillar.put(Pillar.valueOf(entry.getKey().trim().toUpperCase()), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new ScoringConfigurationException("Unknown pillar in weights: " + entry.getKey(), e);
            }
        }
        for (Pillar pillar : Pillar.values()) {
            if (byPillar.get(pillar) == null) {
                throw new ScoringConfigurationException("Missing weight for pillar " + pillar);
            }
        }
        return new PillarWeights(byPillar.get(Pillar.F), byPillar.get(Pillar.T), byPillar.get(Pillar.R),
                byPillar.get(Pillar.O), byPillar.get(Pillar.Q), byPillar.get(Pillar.S));
    }

    public double weightOf(Pillar pillar) {
        return switch (pillar) {
            case F -> f;
            case T -> t;
            case R -> r;
            case O -> o;
            case Q -> q;
            case S -> s;
        };
    }

    /**
     * Weighted sum of pillar scores. Every pillar must be present.
     */
    public double combine(Map<Pillar, Double> scores) {
        double total = 0.0;
        for (Pillar pillar : Pillar.values()) {
            Double score = scores.get(pillar);
            if (score == null) {
                throw new IllegalArgumentException("Missing score for pillar " + pillar);
            }
            total += weightOf(pillar) * score;
        }
        return total;
    }

    public Map<Pillar, Double> asMap() {
        EnumMap<Pillar, Double> map = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            map.put(pillar, weightOf(pillar));
        }
        return map;
    }
}
