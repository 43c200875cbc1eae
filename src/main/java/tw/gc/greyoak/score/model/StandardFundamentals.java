package tw.gc.greyoak.score.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Fundamentals for non-banking companies. Ratios are fractions (0.18 = 18%).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public final class StandardFundamentals implements FundamentalsRecord {

    public static final String VARIANT = "standard";

    Double marketCapCr;
    Double roe3y;
    Double salesCagr3y;
    Double epsCagr3y;
    Double pe;
    Double evEbitda;
    Double debtToEquity;
    Double opm;
    Double opmStdev12q;
    Double roce3y;
    Double dividendPayout;
    LocalDate quarterEnd;

    @Override
    public String variant() {
        return VARIANT;
    }
}
