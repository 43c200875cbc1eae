package tw.gc.greyoak.score.normalization;

public enum NormalizationMethod {
    Z_SCORE,
    ECDF,
    DEGENERATE,     // too few peers or zero dispersion, neutral points
    IMPUTED         // raw value missing, neutral points
}
