package tw.gc.greyoak.score.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDate;

/**
 * Fundamentals of an instrument. Banks report a different metric set from
 * everything else, so the two shapes are mutually exclusive variants.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = StandardFundamentals.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = StandardFundamentals.class, name = "standard"),
        @JsonSubTypes.Type(value = BankingFundamentals.class, name = "banking")
})
public sealed interface FundamentalsRecord permits StandardFundamentals, BankingFundamentals {

    Double getMarketCapCr();

    Double getRoe3y();

    Double getDividendPayout();

    /**
     * Last reported quarter end, drives the results-event window
     */
    LocalDate getQuarterEnd();

    String variant();
}
