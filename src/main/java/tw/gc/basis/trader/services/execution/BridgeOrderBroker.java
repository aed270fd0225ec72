package tw.gc.basis.trader.services.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.model.BrokerOrderStatus;
import tw.gc.basis.trader.model.OrderRequest;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Broker session reached through the local HTTP bridge that fronts the brokerage API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BridgeOrderBroker implements OrderBroker {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TradingProperties tradingProperties;

    private final AtomicBoolean connected = new AtomicBoolean(false);

    private String getBridgeUrl() {
        return tradingProperties.getBridge().getUrl();
    }

    @Override
    public boolean connect() {
        try {
            String response = restTemplate.getForObject(getBridgeUrl() + "/health", String.class);
            JsonNode health = objectMapper.readTree(response);
            boolean ok = "ok".equalsIgnoreCase(health.path("status").asText());
            connected.set(ok);
            if (ok) {
                log.info("✅ Broker bridge connected ({})", getBridgeUrl());
            } else {
                log.error("❌ Broker bridge unhealthy: {}", response);
            }
            return ok;
        } catch (RestClientException | JsonProcessingException | IllegalArgumentException e) {
            log.error("❌ Broker bridge unreachable at {}: {}", getBridgeUrl(), e.getMessage());
            connected.set(false);
            return false;
        }
    }

    @Override
    public void disconnect() {
        if (connected.compareAndSet(true, false)) {
            log.info("🔌 Broker bridge disconnected");
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public String placeOrder(OrderRequest request) {
        Map<String, Object> orderMap = new HashMap<>();
        orderMap.put("side", request.getSide().name());
        orderMap.put("symbol", request.getSymbol());
        orderMap.put("quantity", request.getQuantity());
        orderMap.put("order_type", request.getOrderType().name());
        orderMap.put("limit_price", request.getLimitPrice());
        orderMap.put("signal", request.getSignal());

        log.debug("📤 Sending order to bridge: {}", orderMap);
        JsonNode response = post(getBridgeUrl() + "/orders", orderMap);
        String orderId = response.path("order_id").asText(null);
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalStateException("Bridge rejected order: " + response.path("error").asText("no order id"));
        }
        return orderId;
    }

    @Override
    public BrokerOrderStatus getOrderStatus(String orderId) {
        String json = restTemplate.getForObject(getBridgeUrl() + "/orders/{id}", String.class, orderId);
        JsonNode node = parse(json);
        return new BrokerOrderStatus(
                orderId,
                node.path("status").asText("Unknown"),
                node.path("done").asBoolean(false),
                node.path("filled").asInt(0),
                optionalDouble(node, "avg_fill_price"),
                optionalDouble(node, "commission"));
    }

    @Override
    public void cancelOrder(String orderId) {
        post(getBridgeUrl() + "/orders/" + orderId + "/cancel", Map.of());
        log.info("🚫 Cancel requested for order {}", orderId);
    }

    private JsonNode post(String url, Object body) {
        String json = restTemplate.postForObject(url, body, String.class);
        return parse(json);
    }

    private JsonNode parse(String json) {
        if (json == null) {
            throw new IllegalStateException("Empty response from broker bridge");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed response from broker bridge: " + e.getOriginalMessage(), e);
        }
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asDouble();
    }
}
