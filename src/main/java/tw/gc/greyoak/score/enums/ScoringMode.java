package tw.gc.greyoak.score.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;

/**
 * Investment horizon of a scoring request.
 * Selects the pillar weight set, the liquidity bins and the SectorBear behaviour.
 */
public enum ScoringMode {
    /**
     * Short horizon, momentum heavy, strict liquidity
     */
    TRADER("Trader", "trader"),

    /**
     * Long horizon, fundamentals heavy
     */
    INVESTOR("Investor", "investor");

    private final String code;
    private final String configKey;

    ScoringMode(String code, String configKey) {
        this.code = code;
        this.configKey = configKey;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Key used under scoring.pillar-weights and scoring.risk-penalty.liquidity
     */
    public String getConfigKey() {
        return configKey;
    }

    /**
     * Parse from code or enum name, case-insensitive
     */
    @JsonCreator
    public static ScoringMode fromCode(String code) {
        if (code != null) {
            for (ScoringMode mode : values()) {
                if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                    return mode;
                }
            }
        }
        throw new InvalidScoringInputException("Unknown scoring mode: " + code + " (expected Trader or Investor)");
    }
}
