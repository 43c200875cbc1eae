package tw.gc.greyoak.score.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Everything known about one instrument on one scoring date.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InstrumentSnapshot {
    String ticker;
    LocalDate asOfDate;
    String sectorGroup;
    PriceRecord prices;
    FundamentalsRecord fundamentals;
    OwnershipRecord ownership;

    @JsonIgnore
    public boolean isBanking() {
        return fundamentals instanceof BankingFundamentals;
    }
}
