package tw.gc.greyoak.score.enums;

import tw.gc.greyoak.score.model.PriceRecord;

/**
 * Return horizons used by relative strength and sector momentum.
 * Each horizon pairs a trailing return with the volatility that scales it.
 */
public enum Horizon {
    ONE_MONTH("1M", 21),
    THREE_MONTH("3M", 63),
    SIX_MONTH("6M", 126);

    private final String code;
    private final int tradingDays;

    Horizon(String code, int tradingDays) {
        this.code = code;
        this.tradingDays = tradingDays;
    }

    public String getCode() {
        return code;
    }

    public int getTradingDays() {
        return tradingDays;
    }

    public Double returnOf(PriceRecord prices) {
        return switch (this) {
            case ONE_MONTH -> prices.getRet21d();
            case THREE_MONTH -> prices.getRet63d();
            case SIX_MONTH -> prices.getRet126d();
        };
    }

    /**
     * sigma20 for the 1M horizon, sigma60 for the longer ones
     */
    public Double volatilityOf(PriceRecord prices) {
        return this == ONE_MONTH ? prices.getSigma20() : prices.getSigma60();
    }
}
