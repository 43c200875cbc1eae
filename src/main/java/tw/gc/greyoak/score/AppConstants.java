package tw.gc.greyoak.score;

import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Timezone configuration
    public static final String MARKET_ZONE_ID = "Asia/Kolkata";
    public static final ZoneId MARKET_ZONE = ZoneId.of(MARKET_ZONE_ID);

    // NSE tickers, e.g. RELIANCE.NS
    public static final Pattern TICKER_PATTERN = Pattern.compile("^[A-Z0-9]+\\.NS$");

    // Numeric tolerances
    public static final double TINY = 1e-8;
    public static final double WEIGHT_SUM_TOLERANCE = 1e-9;

    // Point scale shared by normalization, pillars and the final score
    public static final double MIN_POINTS = 0.0;
    public static final double MAX_POINTS = 100.0;
    public static final double NEUTRAL_POINTS = 50.0;

    // Snapshot files
    public static final String SNAPSHOT_FILE_SUFFIX = ".json";

    private AppConstants() {
        // Utility class
    }
}
