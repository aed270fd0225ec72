package tw.gc.basis.trader.enums;

public enum RiskCategory {
    FUNDING,
    BASIS,
    LIQUIDITY,
    CROWDING,
    OPERATIONAL
}
