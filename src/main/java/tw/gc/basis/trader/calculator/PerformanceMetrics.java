package tw.gc.basis.trader.calculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Equity-curve statistics shared by the backtest engine and its reports.
 */
public final class PerformanceMetrics {

    private static final double TRADING_DAYS_PER_YEAR = 365.0;

    private PerformanceMetrics() {
        throw new AssertionError("Utility class");
    }

    /**
     * Largest peak-to-trough drop as a fraction of the running peak.
     */
    public static double maxDrawdown(List<Double> equityCurve) {
        Objects.requireNonNull(equityCurve, "equityCurve");
        if (equityCurve.isEmpty()) {
            return 0.0;
        }
        double peak = equityCurve.get(0);
        double maxDrawdown = 0.0;
        for (double equity : equityCurve) {
            if (equity > peak) {
                peak = equity;
            }
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
            }
        }
        return maxDrawdown;
    }

    /**
     * Relative change between consecutive equity points.
     */
    public static List<Double> returnsFromEquity(List<Double> equityCurve) {
        Objects.requireNonNull(equityCurve, "equityCurve");
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1);
            returns.add(previous != 0.0 ? (equityCurve.get(i) - previous) / previous : 0.0);
        }
        return returns;
    }

    /**
     * mean / sample stdev * sqrt(365). Zero with fewer than two returns or no dispersion.
     */
    public static double sharpeRatio(List<Double> returns) {
        Objects.requireNonNull(returns, "returns");
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double stdev = sampleStdev(returns, mean);
        if (stdev <= 0.0) {
            return 0.0;
        }
        return mean / stdev * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    public static double totalReturn(List<Double> equityCurve) {
        Objects.requireNonNull(equityCurve, "equityCurve");
        if (equityCurve.size() < 2 || equityCurve.get(0) == 0.0) {
            return 0.0;
        }
        double first = equityCurve.get(0);
        return (equityCurve.get(equityCurve.size() - 1) - first) / first;
    }

    static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    static double sampleStdev(List<Double> values, double mean) {
        double sumSq = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / (values.size() - 1));
    }
}
