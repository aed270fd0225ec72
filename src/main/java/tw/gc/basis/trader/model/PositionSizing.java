package tw.gc.basis.trader.model;

/**
 * Delta-neutral leg sizes. The futures notional is the anchor; the spot leg is matched to it.
 *
 * @param contractsNeeded  unrounded contract count implied by the futures target
 * @param futuresContracts rounded contract count, never below 1
 * @param futuresUnits     underlying units covered by the contracts
 * @param futuresValue     contracts * contract size * spot price
 * @param etfShares        shares matching the futures notional, {@code null} without an ETF price
 * @param spotValue        notional of the spot leg (equal to futuresValue without an ETF price)
 * @param deltaNeutral     whether the two notionals differ by less than the tolerance
 */
public record PositionSizing(
        double contractsNeeded,
        int futuresContracts,
        double futuresUnits,
        double futuresValue,
        Integer etfShares,
        double spotValue,
        boolean deltaNeutral
) {
    public boolean hasSpotLeg() {
        return etfShares != null;
    }

    public int etfSharesOrZero() {
        return etfShares != null ? etfShares : 0;
    }

    public double totalExposure() {
        return spotValue + futuresValue;
    }
}
