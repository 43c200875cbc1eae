package tw.gc.greyoak.score.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Fundamentals for banks. roe3y, roa3y and nim3y are fractions;
 * gnpaPct and pcrPct are percentages.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public final class BankingFundamentals implements FundamentalsRecord {

    public static final String VARIANT = "banking";

    Double marketCapCr;
    Double roe3y;
    Double roa3y;
    Double gnpaPct;
    Double pcrPct;
    Double nim3y;
    Double dividendPayout;
    LocalDate quarterEnd;

    @Override
    public String variant() {
        return VARIANT;
    }
}
