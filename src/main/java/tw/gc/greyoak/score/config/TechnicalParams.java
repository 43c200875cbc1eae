package tw.gc.greyoak.score.config;

public record TechnicalParams(double above200Weight,
                              double goldenCrossWeight,
                              double rsiWeight,
                              double breakoutWeight,
                              double volumeWeight,
                              double rsiLow,
                              double rsiHigh,
                              double breakoutAtrMultiplier,
                              double breakoutCloseFraction,
                              int volumeLookback,
                              double volumeRatioLow,
                              double volumeRatioHigh) {

    public double weightSum() {
        return above200Weight + goldenCrossWeight + rsiWeight + breakoutWeight + volumeWeight;
    }
}
