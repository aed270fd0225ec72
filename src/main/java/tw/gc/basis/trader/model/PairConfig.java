package tw.gc.basis.trader.model;

import lombok.Builder;

/**
 * One tradable spot/futures pair, e.g. BTC traded as IBIT shares against MBT contracts.
 *
 * @param pairId        upper-case identifier used for state files and journal records
 * @param spotSymbol    ETF (spot leg) symbol
 * @param futuresSymbol futures (short leg) root symbol
 * @param allocation    fraction of the account assigned to this pair, in (0, 1]
 * @param contractSize  underlying units per futures contract
 */
@Builder
public record PairConfig(
        String pairId,
        String spotSymbol,
        String futuresSymbol,
        double allocation,
        double contractSize
) {
    public PairConfig {
        if (pairId == null || pairId.isBlank()) {
            throw new IllegalArgumentException("pairId is required");
        }
        if (allocation <= 0 || allocation > 1) {
            throw new IllegalArgumentException("allocation must be in (0, 1], got " + allocation);
        }
        if (contractSize <= 0) {
            throw new IllegalArgumentException("contractSize must be positive, got " + contractSize);
        }
    }

    public static PairConfig btc() {
        return new PairConfig("BTC", "IBIT", "MBT", 1.0, 0.1);
    }
}
