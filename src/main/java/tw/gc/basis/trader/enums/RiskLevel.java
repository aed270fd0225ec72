package tw.gc.basis.trader.enums;

/**
 * Ordinal severity buckets used for monitor alerting.
 */
public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }
}
