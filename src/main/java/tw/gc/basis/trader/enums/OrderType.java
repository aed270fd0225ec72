package tw.gc.basis.trader.enums;

public enum OrderType {
    MARKET,
    LIMIT;

    /**
     * Parse the configured order type ("limit" / "market"), defaulting to MARKET.
     */
    public static OrderType fromConfig(String value) {
        return "limit".equalsIgnoreCase(value) ? LIMIT : MARKET;
    }
}
