package tw.gc.greyoak.score.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Guardrail rules in their fixed evaluation order.
 */
public enum GuardrailFlag {
    LOW_DATA_HOLD("LowDataHold", "Low data quality"),
    ILLIQUIDITY("Illiquidity", "Insufficient liquidity"),
    PLEDGE_CAP("PledgeCap", "High promoter pledge"),
    HIGH_RISK_CAP("HighRiskCap", "High risk penalty"),
    SECTOR_BEAR("SectorBear", "Sector in downtrend"),
    LOW_COVERAGE("LowCoverage", "Low data coverage");

    private final String code;
    private final String description;

    GuardrailFlag(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static GuardrailFlag fromCode(String code) {
        for (GuardrailFlag flag : values()) {
            if (flag.code.equalsIgnoreCase(code) || flag.name().equalsIgnoreCase(code)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown guardrail flag: " + code);
    }
}
