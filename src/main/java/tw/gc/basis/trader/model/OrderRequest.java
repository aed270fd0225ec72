package tw.gc.basis.trader.model;

import lombok.Builder;
import lombok.Value;
import tw.gc.basis.trader.enums.OrderSide;
import tw.gc.basis.trader.enums.OrderType;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * A single order leg as proposed by the execution layer.
 */
@Value
@Builder(toBuilder = true)
public class OrderRequest {

    OrderSide side;
    String symbol;
    int quantity;
    @Builder.Default
    OrderType orderType = OrderType.MARKET;
    /** Only set for LIMIT orders */
    Double limitPrice;
    /** Tag such as ENTRY, EXIT or PARTIAL_EXIT */
    String signal;
    String reason;
    LocalDateTime timestamp;

    public boolean isLimit() {
        return orderType == OrderType.LIMIT && limitPrice != null;
    }

    /**
     * Human-readable form, e.g. {@code BUY 120 IBIT (LIMIT @ $52.05)}.
     */
    public String describe() {
        String price = limitPrice != null ? String.format(Locale.US, " @ $%,.2f", limitPrice) : "";
        return String.format(Locale.US, "%s %,d %s (%s%s)", side, quantity, symbol, orderType, price);
    }
}
