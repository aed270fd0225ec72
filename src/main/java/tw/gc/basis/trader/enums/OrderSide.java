package tw.gc.basis.trader.enums;

public enum OrderSide {
    BUY, SELL
}
