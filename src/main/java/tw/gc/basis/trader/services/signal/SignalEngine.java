package tw.gc.basis.trader.services.signal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.calculator.BasisCalculator;
import tw.gc.basis.trader.enums.RiskCategory;
import tw.gc.basis.trader.enums.RiskLevel;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.ReturnMetrics;
import tw.gc.basis.trader.model.RiskAssessment;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.model.StrategyConfig;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static tw.gc.basis.trader.AppConstants.COMPRESSED_BASIS_MONTHLY;
import static tw.gc.basis.trader.AppConstants.ELEVATED_BASIS_MONTHLY;
import static tw.gc.basis.trader.AppConstants.ETF_DISCOUNT_STRESS;
import static tw.gc.basis.trader.AppConstants.HIGH_SENTIMENT;
import static tw.gc.basis.trader.AppConstants.PEAK_BASIS_MONTHLY;
import static tw.gc.basis.trader.AppConstants.STRONG_BASIS_MONTHLY;

/**
 * Maps a market snapshot to a basis-trade signal.
 *
 * <p>Rules are evaluated in a fixed priority order and the first match wins:
 * <ol>
 *   <li>Stop loss: backwardation, compressed basis, basis below funding cost, ETF discount stress</li>
 *   <li>Take profit: peak basis (full exit), elevated basis (partial exit)</li>
 *   <li>Entry: strong basis, then basis above the configured minimum</li>
 * </ol>
 *
 * <p>Only the minimum monthly basis is configurable; every other threshold is a fixed
 * strategy constant shared by live trading and the backtest.
 */
@Slf4j
@Service
public class SignalEngine {

    private static final double HIGH_FUNDING_ANNUAL = 0.06;
    private static final double ETF_TRACKING_BAND = 0.002;
    private static final double CROWDED_OPEN_INTEREST = 40_000;
    private static final double RISING_OPEN_INTEREST = 30_000;
    private static final long NEAR_EXPIRY_DAYS = 7;

    public SignalDecision generateSignal(MarketSnapshot snapshot, StrategyConfig config) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(config, "config");

        double monthlyBasis = snapshot.monthlyBasis();

        if (monthlyBasis < 0) {
            return new SignalDecision(Signal.STOP_LOSS, "Backwardation detected - basis negative");
        }
        if (monthlyBasis < COMPRESSED_BASIS_MONTHLY) {
            return new SignalDecision(Signal.STOP_LOSS, "Basis compressed below 0.2% monthly");
        }

        double monthlyFunding = config.monthlyFundingCost();
        if (monthlyBasis < monthlyFunding) {
            return new SignalDecision(Signal.STOP_LOSS,
                    String.format(Locale.US, "Basis below funding cost (%.2f%% monthly)", monthlyFunding * 100));
        }

        Double discount = snapshot.etfDiscountPremium();
        if (discount != null && discount < ETF_DISCOUNT_STRESS) {
            return new SignalDecision(Signal.STOP_LOSS, "ETF discount > 1% - liquidity stress");
        }

        if (monthlyBasis > PEAK_BASIS_MONTHLY) {
            return new SignalDecision(Signal.FULL_EXIT, "Basis at peak levels (>3.5% monthly) - take profit");
        }
        if (monthlyBasis > ELEVATED_BASIS_MONTHLY) {
            return new SignalDecision(Signal.PARTIAL_EXIT, "Elevated basis (>2.5% monthly) - partial exit");
        }

        if (monthlyBasis > STRONG_BASIS_MONTHLY) {
            Double sentiment = snapshot.getSentimentIndex();
            if (sentiment != null && sentiment > HIGH_SENTIMENT) {
                return new SignalDecision(Signal.STRONG_ENTRY, "Strong basis + high Fear & Greed - optimal entry");
            }
            return new SignalDecision(Signal.STRONG_ENTRY, "Strong basis >1.0% monthly");
        }

        if (monthlyBasis > config.minMonthlyBasis()) {
            return new SignalDecision(Signal.ACCEPTABLE_ENTRY,
                    String.format(Locale.US, "Acceptable basis %.1f-1.0%% monthly", config.minMonthlyBasis() * 100));
        }

        return new SignalDecision(Signal.NO_ENTRY,
                String.format(Locale.US, "Basis too low (%.2f%% monthly, min %.1f%%)",
                        monthlyBasis * 100, config.minMonthlyBasis() * 100));
    }

    public ReturnMetrics calculateReturns(MarketSnapshot snapshot, StrategyConfig config) {
        return BasisCalculator.returns(
                snapshot.getSpotPrice(),
                snapshot.getFuturesPrice(),
                snapshot.daysToExpiry(),
                config.fundingCostAnnual(),
                config.leverage());
    }

    /**
     * Classify funding, basis, liquidity, crowding and operational risk for alerting.
     */
    public RiskAssessment assessRisk(MarketSnapshot snapshot, StrategyConfig config) {
        Map<RiskCategory, RiskAssessment.Factor> factors = new EnumMap<>(RiskCategory.class);

        if (config.fundingCostAnnual() > HIGH_FUNDING_ANNUAL) {
            factors.put(RiskCategory.FUNDING, factor(RiskLevel.HIGH, "Funding cost elevated (>6%)"));
        } else {
            factors.put(RiskCategory.FUNDING, factor(RiskLevel.MODERATE, "Normal funding environment"));
        }

        double monthlyBasis = snapshot.monthlyBasis();
        if (monthlyBasis < 0) {
            factors.put(RiskCategory.BASIS, factor(RiskLevel.CRITICAL, "Backwardation (negative carry)"));
        } else if (monthlyBasis < config.minMonthlyBasis()) {
            factors.put(RiskCategory.BASIS, factor(RiskLevel.HIGH, "Basis near zero"));
        } else {
            factors.put(RiskCategory.BASIS, factor(RiskLevel.LOW, "Positive contango"));
        }

        Double discount = snapshot.etfDiscountPremium();
        if (discount != null && discount < ETF_DISCOUNT_STRESS) {
            factors.put(RiskCategory.LIQUIDITY, factor(RiskLevel.HIGH, "ETF trading at discount >1%"));
        } else if (discount != null && Math.abs(discount) < ETF_TRACKING_BAND) {
            factors.put(RiskCategory.LIQUIDITY, factor(RiskLevel.LOW, "ETF tracking NAV closely"));
        } else {
            factors.put(RiskCategory.LIQUIDITY, factor(RiskLevel.MODERATE, "Normal ETF tracking"));
        }

        Double openInterest = snapshot.getOpenInterest();
        if (openInterest != null && openInterest > CROWDED_OPEN_INTEREST) {
            factors.put(RiskCategory.CROWDING, factor(RiskLevel.HIGH, "Open interest >40k contracts (crowded)"));
        } else if (openInterest != null && openInterest > RISING_OPEN_INTEREST) {
            factors.put(RiskCategory.CROWDING, factor(RiskLevel.MODERATE, "Open interest rising"));
        } else {
            factors.put(RiskCategory.CROWDING, factor(RiskLevel.LOW, "Healthy open interest"));
        }

        if (snapshot.daysToExpiry() < NEAR_EXPIRY_DAYS) {
            factors.put(RiskCategory.OPERATIONAL, factor(RiskLevel.HIGH, "Near expiry (rollover soon)"));
        } else {
            factors.put(RiskCategory.OPERATIONAL, factor(RiskLevel.LOW, "Sufficient time to expiry"));
        }

        RiskAssessment assessment = new RiskAssessment(factors);
        log.debug("Risk for {}: overall {} ({} elevated)", snapshot.getPairId(), assessment.overall(), assessment.elevatedCount());
        return assessment;
    }

    private static RiskAssessment.Factor factor(RiskLevel level, String description) {
        return new RiskAssessment.Factor(level, description);
    }
}
