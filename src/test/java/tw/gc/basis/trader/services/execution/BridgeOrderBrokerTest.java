package tw.gc.basis.trader.services.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.enums.OrderSide;
import tw.gc.basis.trader.enums.OrderType;
import tw.gc.basis.trader.model.BrokerOrderStatus;
import tw.gc.basis.trader.model.OrderRequest;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BridgeOrderBrokerTest {

    private static final String BRIDGE = "http://localhost:8888";

    @Mock
    private RestTemplate restTemplate;

    private BridgeOrderBroker broker;

    @BeforeEach
    void setUp() {
        broker = new BridgeOrderBroker(restTemplate, new ObjectMapper(), new TradingProperties());
    }

    @Test
    void connectsWhenBridgeHealthy() {
        when(restTemplate.getForObject(eq(BRIDGE + "/health"), eq(String.class)))
                .thenReturn("{\"status\":\"ok\"}");

        assertThat(broker.connect()).isTrue();
        assertThat(broker.isConnected()).isTrue();

        broker.disconnect();
        assertThat(broker.isConnected()).isFalse();
    }

    @Test
    void unreachableBridgeIsNotConnected() {
        when(restTemplate.getForObject(anyString(), eq(String.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        assertThat(broker.connect()).isFalse();
        assertThat(broker.isConnected()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void placeOrderPostsOrderFields() {
        when(restTemplate.postForObject(eq(BRIDGE + "/orders"), any(), eq(String.class)))
                .thenReturn("{\"order_id\":\"1001\"}");
        OrderRequest request = OrderRequest.builder()
                .side(OrderSide.BUY)
                .symbol("IBIT")
                .quantity(120)
                .orderType(OrderType.LIMIT)
                .limitPrice(52.05)
                .signal("ENTRY")
                .build();

        String orderId = broker.placeOrder(request);

        assertThat(orderId).isEqualTo("1001");
        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForObject(eq(BRIDGE + "/orders"), body.capture(), eq(String.class));
        Map<String, Object> sent = (Map<String, Object>) body.getValue();
        assertThat(sent).containsEntry("side", "BUY")
                .containsEntry("symbol", "IBIT")
                .containsEntry("quantity", 120)
                .containsEntry("order_type", "LIMIT")
                .containsEntry("limit_price", 52.05)
                .containsEntry("signal", "ENTRY");
    }

    @Test
    void placeOrderWithoutIdThrows() {
        when(restTemplate.postForObject(anyString(), any(), eq(String.class)))
                .thenReturn("{\"error\":\"unknown symbol\"}");
        OrderRequest request = OrderRequest.builder().side(OrderSide.SELL).symbol("XXX").quantity(1).build();

        assertThatThrownBy(() -> broker.placeOrder(request))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Bridge rejected order: unknown symbol");
    }

    @Test
    void orderStatusIsParsed() {
        when(restTemplate.getForObject(eq(BRIDGE + "/orders/{id}"), eq(String.class), eq("1001")))
                .thenReturn("{\"status\":\"Filled\",\"done\":true,\"filled\":120,\"avg_fill_price\":52.01,\"commission\":null}");

        BrokerOrderStatus status = broker.getOrderStatus("1001");

        assertThat(status.isFilled()).isTrue();
        assertThat(status.done()).isTrue();
        assertThat(status.filled()).isEqualTo(120);
        assertThat(status.avgFillPrice()).isEqualTo(52.01);
        assertThat(status.commission()).isNull();
    }

    @Test
    void cancelPostsToOrderEndpoint() {
        when(restTemplate.postForObject(anyString(), any(), eq(String.class))).thenReturn("{\"status\":\"ok\"}");

        broker.cancelOrder("1001");

        verify(restTemplate).postForObject(eq(BRIDGE + "/orders/1001/cancel"), any(), eq(String.class));
    }
}
