package tw.gc.basis.trader;

import java.time.ZoneId;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // CME / US ETF session calendar
    public static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");

    // Signal thresholds, expressed as monthly basis fractions
    public static final double COMPRESSED_BASIS_MONTHLY = 0.002;
    public static final double PEAK_BASIS_MONTHLY = 0.035;
    public static final double ELEVATED_BASIS_MONTHLY = 0.025;
    public static final double STRONG_BASIS_MONTHLY = 0.01;
    public static final double ETF_DISCOUNT_STRESS = -0.01;
    public static final double HIGH_SENTIMENT = 0.8;

    // Spot and futures notional may differ by less than this and still count as hedged
    public static final double DELTA_NEUTRAL_TOLERANCE = 1000.0;

    public static final double PARTIAL_EXIT_FRACTION = 0.5;

    private AppConstants() {
        // Utility class
    }
}
