package tw.gc.basis.trader.model;

import lombok.Builder;

/**
 * Immutable strategy parameters. The leg target percentages are informational;
 * sizing is driven by the futures target amount.
 */
@Builder(toBuilder = true)
public record StrategyConfig(
        double accountSize,
        double spotTargetPct,
        double futuresTargetPct,
        double fundingCostAnnual,
        double leverage,
        double contractSize,
        double minMonthlyBasis
) {
    public StrategyConfig {
        if (accountSize <= 0) {
            throw new IllegalArgumentException("accountSize must be positive, got " + accountSize);
        }
        if (contractSize <= 0) {
            throw new IllegalArgumentException("contractSize must be positive, got " + contractSize);
        }
        if (spotTargetPct < 0 || futuresTargetPct < 0) {
            throw new IllegalArgumentException("target allocations must not be negative");
        }
        if (leverage <= 0) {
            throw new IllegalArgumentException("leverage must be positive, got " + leverage);
        }
    }

    public static StrategyConfig defaults() {
        return new StrategyConfig(200_000, 0.50, 0.50, 0.05, 1.0, 5.0, 0.005);
    }

    public double spotTargetAmount() {
        return accountSize * spotTargetPct;
    }

    public double futuresTargetAmount() {
        return accountSize * futuresTargetPct;
    }

    public double monthlyFundingCost() {
        return fundingCostAnnual / 12;
    }

    /**
     * Derive the config for one pair: account size scaled by the pair's allocation,
     * contract size taken from the pair. This instance is left untouched.
     */
    public StrategyConfig forPair(PairConfig pair) {
        return toBuilder()
                .accountSize(accountSize * pair.allocation())
                .contractSize(pair.contractSize())
                .build();
    }
}
