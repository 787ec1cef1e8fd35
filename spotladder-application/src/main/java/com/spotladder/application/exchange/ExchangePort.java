package com.spotladder.application.exchange;

import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;

import java.math.BigDecimal;

/**
 * The minimal query/mutate surface the workflow needs from a spot exchange.
 *
 * <p>Implementations are stateful (symbol cache, simulated orders) and meant to be shared by reference
 * between the workflow and reconciliation for one process run. Every call blocks until the remote side
 * answers or the per-call timeout expires; all failures surface as {@link GatewayException}.
 */
public interface ExchangePort {

    ExchangeId id();

    BigDecimal availableBalance(String currency);

    BigDecimal highestBid(String symbol);

    BigDecimal lowestAsk(String symbol);

    /**
     * Places a limit order. Amount and price are quantized before they are sent.
     *
     * @return the acknowledged order, without note or link
     */
    OrderRecord createLimitOrder(String symbol, OrderSide side, BigDecimal amount, BigDecimal price);

    OrderStatus orderStatus(String orderId);

    OrderStatus cancelOrder(String orderId);
}
