package tw.gc.basis.trader.services.execution;

/**
 * Human approval step before orders are sent when auto-trade is off.
 */
public interface TradeConfirmation {

    /**
     * @param summary human-readable description of the pending trade
     * @return true to execute, false to skip
     */
    boolean confirm(String summary);
}
