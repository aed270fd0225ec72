package tw.gc.basis.trader.services.execution;

import tw.gc.basis.trader.model.BrokerOrderStatus;
import tw.gc.basis.trader.model.OrderRequest;

/**
 * Order placement primitives of a broker session. Position state is never read back from
 * the broker; each pair tracks its own.
 */
public interface OrderBroker {

    boolean connect();

    void disconnect();

    boolean isConnected();

    /**
     * Submit an order without waiting for it.
     *
     * @return broker order id
     */
    String placeOrder(OrderRequest request);

    BrokerOrderStatus getOrderStatus(String orderId);

    void cancelOrder(String orderId);
}
