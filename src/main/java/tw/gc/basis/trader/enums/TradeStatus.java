package tw.gc.basis.trader.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a simulated backtest trade. Every state except OPEN is terminal.
 */
public enum TradeStatus {
    OPEN("open"),
    CLOSED("closed"),
    STOPPED_OUT("stopped_out"),
    FORCED_CLOSE("forced_close");

    private final String code;

    TradeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }
}
