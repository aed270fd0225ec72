package tw.gc.basis.trader.calculator;

import tw.gc.basis.trader.model.ReturnMetrics;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Pure basis and carry-return arithmetic. Percentages are fractions (0.02 = 2%).
 * A non-positive days-to-expiry yields zero time-normalized metrics.
 */
public final class BasisCalculator {

    private static final double DAYS_PER_MONTH = 30.0;
    private static final double DAYS_PER_YEAR = 365.0;

    private BasisCalculator() {
        throw new AssertionError("Utility class");
    }

    public static double basisAbsolute(double spotPrice, double futuresPrice) {
        return futuresPrice - spotPrice;
    }

    public static double basisPercent(double spotPrice, double futuresPrice) {
        if (spotPrice <= 0) {
            return 0.0;
        }
        return basisAbsolute(spotPrice, futuresPrice) / spotPrice;
    }

    public static long daysToExpiry(LocalDate expiry, LocalDate reference) {
        Objects.requireNonNull(expiry, "expiry");
        Objects.requireNonNull(reference, "reference");
        return ChronoUnit.DAYS.between(reference, expiry);
    }

    public static double monthlyBasis(double basisPercent, long daysToExpiry) {
        if (daysToExpiry <= 0) {
            return 0.0;
        }
        return basisPercent * (DAYS_PER_MONTH / daysToExpiry);
    }

    public static double annualizedBasis(double basisPercent, long daysToExpiry) {
        if (daysToExpiry <= 0) {
            return 0.0;
        }
        return basisPercent * (DAYS_PER_YEAR / daysToExpiry);
    }

    public static Double etfDiscountPremium(Double etfPrice, Double etfNav) {
        if (etfPrice == null || etfNav == null || etfPrice == 0.0 || etfNav == 0.0) {
            return null;
        }
        return (etfPrice - etfNav) / etfNav;
    }

    /**
     * Gross annualized carry, net of funding, and the leveraged net return.
     */
    public static ReturnMetrics returns(double spotPrice, double futuresPrice, long daysToExpiry,
                                        double fundingCostAnnual, double leverage) {
        if (daysToExpiry <= 0) {
            return ReturnMetrics.zero();
        }
        double basisPercent = basisPercent(spotPrice, futuresPrice);
        double grossAnnualized = annualizedBasis(basisPercent, daysToExpiry);
        double netAnnualized = grossAnnualized - fundingCostAnnual;
        return new ReturnMetrics(
                basisAbsolute(spotPrice, futuresPrice),
                basisPercent,
                monthlyBasis(basisPercent, daysToExpiry),
                grossAnnualized,
                netAnnualized,
                netAnnualized * leverage);
    }

    public static boolean isContango(double spotPrice, double futuresPrice) {
        return futuresPrice > spotPrice;
    }

    public static boolean isBackwardation(double spotPrice, double futuresPrice) {
        return futuresPrice < spotPrice;
    }
}
