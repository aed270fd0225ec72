package tw.gc.basis.trader.services.execution;

import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.enums.TradeAction;
import tw.gc.basis.trader.model.OrderResult;

/**
 * What {@link ExecutionManager} did with one signal.
 *
 * @param spotResult    spot leg result, {@code null} when the leg was not submitted
 * @param futuresResult futures leg result, {@code null} when the leg was not submitted
 */
public record ExecutionOutcome(
        Signal signal,
        TradeAction action,
        Status status,
        String message,
        OrderResult spotResult,
        OrderResult futuresResult
) {

    public enum Status {
        NO_ACTION,
        REJECTED,
        USER_REJECTED,
        CONNECTION_FAILED,
        /** Every submitted leg filled, or was accepted in dry-run */
        COMPLETED,
        /** Some quantity traded but not everything requested */
        PARTIAL,
        /** Nothing traded */
        FAILED
    }

    public static ExecutionOutcome noAction(Signal signal) {
        return new ExecutionOutcome(signal, TradeAction.NONE, Status.NO_ACTION, null, null, null);
    }

    public static ExecutionOutcome skipped(Signal signal, TradeAction action, Status status, String message) {
        return new ExecutionOutcome(signal, action, status, message, null, null);
    }

    public boolean isExecuted() {
        return status == Status.COMPLETED || status == Status.PARTIAL;
    }
}
