package tw.gc.basis.trader.services.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.enums.OrderStatus;
import tw.gc.basis.trader.model.BrokerOrderStatus;
import tw.gc.basis.trader.model.OrderRequest;
import tw.gc.basis.trader.model.OrderResult;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Submits single order legs and blocks until each one is filled, rejected or timed out.
 *
 * <p>A working order is polled at a fixed cadence. When the timeout elapses the order is
 * cancelled and whatever filled before the cancel is reported as a partial fill.
 * In dry-run mode nothing reaches the broker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderExecutor {

    private final OrderBroker broker;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private TradingProperties.Execution settings() {
        return tradingProperties.getExecution();
    }

    public boolean isDryRun() {
        return settings().isDryRun();
    }

    public boolean connect() {
        if (isDryRun()) {
            log.info("[DRY RUN] Skipping broker connection");
            return true;
        }
        return broker.connect();
    }

    public void disconnect() {
        if (broker.isConnected()) {
            broker.disconnect();
        }
    }

    public boolean isConnected() {
        return broker.isConnected();
    }

    /**
     * Execute one order leg. Never throws for broker failures; they come back as FAILED,
     * or as PARTIALLY_FILLED / FILLED when a live order filled before tracking it failed.
     */
    public OrderResult submit(OrderRequest request) {
        if (isDryRun()) {
            log.info("[DRY RUN] Would execute: {}", request.describe());
            return OrderResult.dryRun(request, now());
        }

        if (!broker.isConnected()) {
            return OrderResult.failed(request, "Not connected to broker", now());
        }

        try {
            return placeAndWait(request);
        } catch (RuntimeException e) {
            log.error("❌ Order execution failed for {}: {}", request.describe(), e.getMessage(), e);
            return OrderResult.failed(request, e.getMessage(), now());
        }
    }

    private OrderResult placeAndWait(OrderRequest request) {
        String orderId = broker.placeOrder(request);
        log.info("📤 Order {} placed: {}", orderId, request.describe());

        long timeoutNanos = TimeUnit.SECONDS.toNanos(settings().getOrderTimeoutSeconds());
        long deadline = System.nanoTime() + timeoutNanos;
        boolean interrupted = false;

        try {
            BrokerOrderStatus status = broker.getOrderStatus(orderId);
            while (!status.done() && System.nanoTime() - deadline < 0) {
                try {
                    Thread.sleep(settings().getPollIntervalMs());
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
                status = broker.getOrderStatus(orderId);
            }

            if (status.done()) {
                return completed(request, status);
            }
            return cancelAfterTimeout(request, orderId);
        } catch (RuntimeException e) {
            return recoverAfterError(request, orderId, e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The order is live at the broker but tracking it failed. Cancel it and report whatever
     * filled, so the caller never loses inventory the broker already holds.
     */
    private OrderResult recoverAfterError(OrderRequest request, String orderId, RuntimeException cause) {
        log.error("❌ Lost track of order {} ({}) - cancelling", orderId, cause.getMessage(), cause);
        tryCancel(orderId);

        BrokerOrderStatus status;
        try {
            status = broker.getOrderStatus(orderId);
        } catch (RuntimeException e) {
            log.error("🚨 Order {} state unknown after cancel: {}", orderId, e.getMessage(), e);
            return OrderResult.failed(request, "Order " + orderId + " state unknown: " + cause.getMessage(), now());
        }

        if (status.isFilled()) {
            return completed(request, status);
        }
        if (status.filled() > 0) {
            return partialFill(request, status, "Partial fill (" + status.filled() + "/" + request.getQuantity()
                    + ") before broker error: " + cause.getMessage());
        }
        return OrderResult.failed(request, cause.getMessage(), now());
    }

    private void tryCancel(String orderId) {
        try {
            broker.cancelOrder(orderId);
        } catch (RuntimeException e) {
            log.error("❌ Cancel failed for order {}: {}", orderId, e.getMessage(), e);
        }
    }

    private OrderResult completed(OrderRequest request, BrokerOrderStatus status) {
        if (status.isFilled()) {
            log.info("✅ Order {} filled: {} @ {}", status.orderId(), status.filled(), status.avgFillPrice());
            return OrderResult.builder()
                    .status(OrderStatus.FILLED)
                    .request(request)
                    .fillPrice(status.avgFillPrice())
                    .filledQuantity(status.filled() > 0 ? status.filled() : request.getQuantity())
                    .commission(status.commission())
                    .timestamp(now())
                    .build();
        }
        if (status.filled() > 0) {
            return partialFill(request, status, "Order ended with status: " + status.status()
                    + " after partial fill (" + status.filled() + "/" + request.getQuantity() + ")");
        }
        log.warn("⚠️ Order {} ended with status {}", status.orderId(), status.status());
        return OrderResult.failed(request, "Order ended with status: " + status.status(), now());
    }

    private OrderResult cancelAfterTimeout(OrderRequest request, String orderId) {
        log.warn("⏱️ Order {} timeout after {}s - cancelling", orderId, settings().getOrderTimeoutSeconds());
        tryCancel(orderId);
        BrokerOrderStatus status = broker.getOrderStatus(orderId);

        if (status.isFilled()) {
            return completed(request, status);
        }
        if (status.filled() > 0) {
            return partialFill(request, status,
                    "Partial fill (" + status.filled() + "/" + request.getQuantity() + ") before timeout");
        }
        return OrderResult.builder()
                .status(OrderStatus.CANCELLED)
                .request(request)
                .error("Order cancelled due to timeout")
                .timestamp(now())
                .build();
    }

    private OrderResult partialFill(OrderRequest request, BrokerOrderStatus status, String message) {
        log.warn("⚠️ {} - {}", request.describe(), message);
        return OrderResult.builder()
                .status(OrderStatus.PARTIALLY_FILLED)
                .request(request)
                .fillPrice(status.avgFillPrice())
                .filledQuantity(status.filled())
                .commission(status.commission())
                .error(message)
                .timestamp(now())
                .build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
