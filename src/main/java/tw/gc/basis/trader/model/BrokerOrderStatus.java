package tw.gc.basis.trader.model;

/**
 * Broker-side view of a working order, as returned by a status poll.
 *
 * @param status       broker status text, e.g. "Submitted", "Filled", "Cancelled"
 * @param done         whether the broker stopped working the order
 * @param filled       quantity filled so far
 * @param avgFillPrice average fill price, {@code null} before the first fill
 * @param commission   total commission, {@code null} when not reported
 */
public record BrokerOrderStatus(
        String orderId,
        String status,
        boolean done,
        int filled,
        Double avgFillPrice,
        Double commission
) {
    public boolean isFilled() {
        return "Filled".equalsIgnoreCase(status);
    }
}
