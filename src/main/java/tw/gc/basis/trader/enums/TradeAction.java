package tw.gc.basis.trader.enums;

/**
 * High-level action derived from a signal and the tracked position.
 */
public enum TradeAction {
    OPEN,
    CLOSE,
    REDUCE,
    NONE;

    public static TradeAction resolve(Signal signal, boolean positionOpen) {
        return switch (signal) {
            case STRONG_ENTRY, ACCEPTABLE_ENTRY -> positionOpen ? NONE : OPEN;
            case FULL_EXIT, STOP_LOSS -> positionOpen ? CLOSE : NONE;
            case PARTIAL_EXIT -> positionOpen ? REDUCE : NONE;
            case NO_ENTRY, HOLD -> NONE;
        };
    }
}
