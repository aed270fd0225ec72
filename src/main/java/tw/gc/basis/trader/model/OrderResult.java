package tw.gc.basis.trader.model;

import lombok.Builder;
import lombok.Value;
import tw.gc.basis.trader.enums.OrderStatus;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one order leg.
 */
@Value
@Builder
public class OrderResult {

    public static final String DRY_RUN_MESSAGE = "Dry run - order not submitted";

    OrderStatus status;
    OrderRequest request;
    Double fillPrice;
    int filledQuantity;
    Double commission;
    String error;
    LocalDateTime timestamp;

    public static OrderResult dryRun(OrderRequest request, LocalDateTime timestamp) {
        return OrderResult.builder()
                .status(OrderStatus.PENDING)
                .request(request)
                .error(DRY_RUN_MESSAGE)
                .timestamp(timestamp)
                .build();
    }

    public static OrderResult failed(OrderRequest request, String error, LocalDateTime timestamp) {
        return OrderResult.builder()
                .status(OrderStatus.FAILED)
                .request(request)
                .error(error)
                .timestamp(timestamp)
                .build();
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    /**
     * Quantity that actually changed hands: the full fill, a partial fill, or nothing.
     */
    public int executedQuantity() {
        return switch (status) {
            case FILLED -> filledQuantity > 0 ? filledQuantity : request.getQuantity();
            case PARTIALLY_FILLED -> filledQuantity;
            default -> 0;
        };
    }

    /**
     * Flat map written to the execution journal.
     */
    public Map<String, Object> toJournalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.name());
        map.put("side", request.getSide().name());
        map.put("symbol", request.getSymbol());
        map.put("requested_qty", request.getQuantity());
        map.put("order_type", request.getOrderType().name());
        map.put("limit_price", request.getLimitPrice());
        map.put("fill_price", fillPrice);
        map.put("filled_qty", filledQuantity);
        map.put("commission", commission);
        map.put("error", error);
        map.put("signal", request.getSignal());
        map.put("timestamp", timestamp != null ? timestamp.toString() : null);
        return map;
    }
}
