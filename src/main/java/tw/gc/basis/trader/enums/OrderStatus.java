package tw.gc.basis.trader.enums;

public enum OrderStatus {
    PENDING,
    SUBMITTED,
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED,
    FAILED;

    /**
     * Whether the broker has finished working the order.
     */
    public boolean isDone() {
        return this == FILLED || this == CANCELLED || this == FAILED;
    }
}
