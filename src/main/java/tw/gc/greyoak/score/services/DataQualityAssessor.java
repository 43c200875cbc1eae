package tw.gc.greyoak.score.services;

import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.model.BankingFundamentals;
import tw.gc.greyoak.score.model.FundamentalsRecord;
import tw.gc.greyoak.score.model.InstrumentSnapshot;
import tw.gc.greyoak.score.model.DataQuality;
import tw.gc.greyoak.score.model.OwnershipRecord;
import tw.gc.greyoak.score.model.PriceRecord;
import tw.gc.greyoak.score.model.StandardFundamentals;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the required fields that are present (non-null and finite).
 *
 * Required: close, volume, rsi14, atr14, dma20, dma200, market cap, roe3y,
 * salesCagr3y (roa3y for banks), promoter holding and FII holding.
 */
@Component
public class DataQualityAssessor {

    public DataQuality assess(InstrumentSnapshot snapshot) {
        PriceRecord prices = snapshot.getPrices();
        FundamentalsRecord fundamentals = snapshot.getFundamentals();
        OwnershipRecord ownership = snapshot.getOwnership();

        Map<String, Double> required = new LinkedHashMap<>();
        required.put("close", prices.getClose());
        required.put("volume", prices.getVolume());
        required.put("rsi14", prices.getRsi14());
        required.put("atr14", prices.getAtr14());
        required.put("dma20", prices.getDma20());
        required.put("dma200", prices.getDma200());
        required.put("marketCapCr", fundamentals.getMarketCapCr());
        required.put("roe3y", fundamentals.getRoe3y());
        if (fundamentals instanceof BankingFundamentals banking) {
            required.put("roa3y", banking.getRoa3y());
        } else {
            required.put("salesCagr3y", ((StandardFundamentals) fundamentals).getSalesCagr3y());
        }
        required.put("promoterHoldPct", ownership.getPromoterHoldPct());
        required.put("fiiHoldPct", ownership.getFiiHoldPct());

        List<String> missing = new ArrayList<>();
        required.forEach((field, value) -> {
            if (value == null || !Double.isFinite(value)) {
                missing.add(field);
            }
        });
        return new DataQuality(required.size(), required.size() - missing.size(), missing);
    }
}
