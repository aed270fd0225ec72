package tw.gc.basis.trader.model;

import lombok.Builder;
import lombok.Value;
import tw.gc.basis.trader.AppConstants;
import tw.gc.basis.trader.calculator.BasisCalculator;

import java.time.LocalDate;

/**
 * Normalized market state for one pair at one point in time.
 * Optional inputs are {@code null} when the feed did not provide them.
 */
@Value
@Builder(toBuilder = true)
public class MarketSnapshot {

    String pairId;
    String spotSymbol;
    String futuresSymbol;

    double spotPrice;
    double futuresPrice;
    LocalDate futuresExpiry;

    Double etfPrice;
    Double etfNav;
    /** Fear and greed reading scaled to [0, 1] */
    Double sentimentIndex;
    Double openInterest;

    /** Reference date; live snapshots without one are evaluated against today in the exchange zone */
    LocalDate asOf;

    public LocalDate referenceDate() {
        return asOf != null ? asOf : LocalDate.now(AppConstants.EXCHANGE_ZONE);
    }

    public double basisAbsolute() {
        return BasisCalculator.basisAbsolute(spotPrice, futuresPrice);
    }

    public double basisPercent() {
        return BasisCalculator.basisPercent(spotPrice, futuresPrice);
    }

    public long daysToExpiry() {
        return BasisCalculator.daysToExpiry(futuresExpiry, referenceDate());
    }

    public double monthlyBasis() {
        return BasisCalculator.monthlyBasis(basisPercent(), daysToExpiry());
    }

    public double annualizedBasis() {
        return BasisCalculator.annualizedBasis(basisPercent(), daysToExpiry());
    }

    /**
     * (etf price - nav) / nav, or {@code null} when either input is missing or zero.
     */
    public Double etfDiscountPremium() {
        return BasisCalculator.etfDiscountPremium(etfPrice, etfNav);
    }

    public boolean hasEtfPrice() {
        return etfPrice != null && etfPrice > 0;
    }
}
