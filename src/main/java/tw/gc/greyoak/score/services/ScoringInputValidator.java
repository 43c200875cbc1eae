package tw.gc.greyoak.score.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;
import tw.gc.greyoak.score.model.BankingFundamentals;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.MarketBenchmark;
import tw.gc.greyoak.score.model.PeerSet;
import tw.gc.greyoak.score.model.PillarWeights;

import java.time.LocalDate;

/**
 * Fail-fast checks run before any computation. Missing metric values are not
 * validated here; they are scored neutrally and reflected in confidence.
 */
@Component
@RequiredArgsConstructor
public class ScoringInputValidator {

    private final ScoringConfig config;

    public void validate(InstrumentSnapshot snapshot, ScoringMode mode, LocalDate asOfDate) {
        if (snapshot == null) {
            throw new InvalidScoringInputException("Snapshot is required");
        }
        validateTicker(snapshot.getTicker());
        if (mode == null) {
            throw new InvalidScoringInputException("Scoring mode is required for " + snapshot.getTicker());
        }
        if (asOfDate == null) {
            throw new InvalidScoringInputException("Scoring date is required for " + snapshot.getTicker());
        }
        if (snapshot.getAsOfDate() != null && !snapshot.getAsOfDate().equals(asOfDate)) {
            throw new InvalidScoringInputException("Snapshot " + snapshot.getTicker() + " is dated "
                    + snapshot.getAsOfDate() + ", not " + asOfDate);
        }

        String sector = snapshot.getSectorGroup();
        if (!config.isKnownSector(sector)) {
            throw new InvalidScoringInputException("Unknown sector group '" + sector + "' for " + snapshot.getTicker());
        }
        if (snapshot.getPrices() == null || snapshot.getFundamentals() == null || snapshot.getOwnership() == null) {
            throw new InvalidScoringInputException("Snapshot " + snapshot.getTicker()
                    + " must carry price, fundamentals and ownership records");
        }

        boolean bankingRecord = snapshot.getFundamentals() instanceof BankingFundamentals;
        if (bankingRecord != config.isBankingSector(sector)) {
            throw new InvalidScoringInputException("Snapshot " + snapshot.getTicker() + " in sector '" + sector
                    + "' carries " + snapshot.getFundamentals().variant() + " fundamentals");
        }
    }

    /**
     * Checks the comparison inputs handed to a single scoring call. Assumes
     * {@link #validate} already passed for the snapshot.
     */
    public void validateContext(InstrumentSnapshot snapshot, PeerSet peerSet, MarketBenchmark benchmark,
                                PillarWeights weights, LocalDate asOfDate) {
        String ticker = snapshot.getTicker();
        if (peerSet == null) {
            throw new InvalidScoringInputException("Peer set is required for " + ticker);
        }
        if (!peerSet.sectorGroup().equals(snapshot.getSectorGroup())) {
            throw new InvalidScoringInputException("Peer set for sector '" + peerSet.sectorGroup()
                    + "' does not match " + ticker + " in sector '" + snapshot.getSectorGroup() + "'");
        }
        if (!asOfDate.equals(peerSet.asOfDate())) {
            throw new InvalidScoringInputException("Peer set is dated " + peerSet.asOfDate() + ", not " + asOfDate);
        }
        if (benchmark == null) {
            throw new InvalidScoringInputException("Market benchmark is required for " + ticker);
        }
        if (!asOfDate.equals(benchmark.asOfDate())) {
            throw new InvalidScoringInputException("Market benchmark is dated " + benchmark.asOfDate()
                    + ", not " + asOfDate);
        }
        if (weights == null) {
            throw new InvalidScoringInputException("Pillar weights are required for " + ticker);
        }
    }

    public void validateTicker(String ticker) {
        if (ticker == null || !AppConstants.TICKER_PATTERN.matcher(ticker).matches()) {
            throw new InvalidScoringInputException("Invalid ticker '" + ticker + "' (expected e.g. RELIANCE.NS)");
        }
    }
}
