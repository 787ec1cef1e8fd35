package com.spotladder.application.service;

import com.spotladder.application.exchange.ExchangePort;
import com.spotladder.application.ports.OrderLedgerPort;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import com.spotladder.domain.order.Ticks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brings the local ledger in line with the exchange and closes out filled buys.
 *
 * <p>Per run, in ledger order: poll every non-terminal record; when a buy is FILLED and has no linked sell,
 * place a sell for the same amount at the markup, append it and link the buy to it. The ledger is saved
 * once at the end. The link is checked before a sell is placed and saved together with the sell, so a
 * filled buy gets at most one sell however many times this runs.
 *
 * <p>If a gateway call fails midway, whatever was already done (including sells already placed) is saved
 * before the exception propagates.
 */
public final class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final ExchangePort exchange;
    private final OrderLedgerPort ledger;
    private final BigDecimal sellMarkup;

    public ReconciliationService(ExchangePort exchange, OrderLedgerPort ledger, BigDecimal sellMarkup) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.sellMarkup = Objects.requireNonNull(sellMarkup, "sellMarkup");
    }

    public ReconciliationReport reconcile() {
        List<OrderRecord> orders = new ArrayList<>(ledger.load());
        if (orders.isEmpty()) {
            log.info("No orders to sync yet");
            return ReconciliationReport.empty();
        }

        List<ReconciliationReport.StatusChange> changes = new ArrayList<>();
        List<OrderRecord> sells = new ArrayList<>();
        boolean dirty = false;

        // Sells appended during this run are polled on the next one.
        int stored = orders.size();
        try {
            for (int i = 0; i < stored; i++) {
                OrderRecord order = orders.get(i);

                if (!order.status().isTerminal()) {
                    OrderStatus before = order.status();
                    OrderStatus remote = exchange.orderStatus(order.orderId());
                    if (order.transitionTo(remote)) {
                        changes.add(new ReconciliationReport.StatusChange(order.orderId(), before, remote));
                        dirty = true;
                        log.info("Order {} new status: {} -> {}", order.orderId(), before, remote);
                    }
                }

                if (order.awaitsLinkedSell()) {
                    OrderRecord sell = placeLinkedSell(order);
                    orders.add(sell);
                    order.linkTo(sell.orderId());
                    sells.add(sell);
                    dirty = true;
                    log.info("Created linked sell order {} at {} for buy {}",
                            sell.orderId(), sell.price().toPlainString(), order.orderId());
                }
            }
        } catch (RuntimeException e) {
            if (dirty) {
                log.warn("Reconciliation failed after changes; saving progress before propagating: {}", e.getMessage());
                try {
                    ledger.save(orders);
                } catch (RuntimeException saveFailure) {
                    e.addSuppressed(saveFailure);
                }
            }
            throw e;
        }

        if (dirty) {
            ledger.save(orders);
            log.info("Ledger updated: {} status change(s), {} linked sell(s)", changes.size(), sells.size());
        } else {
            log.debug("Ledger already in sync ({} record(s))", stored);
        }
        return new ReconciliationReport(changes, sells, dirty);
    }

    private OrderRecord placeLinkedSell(OrderRecord buy) {
        BigDecimal sellPrice = Ticks.markedUp(buy.price(), sellMarkup);
        OrderRecord placed = exchange.createLimitOrder(buy.symbol(), OrderSide.SELL, buy.amount(), sellPrice);
        return placed
                .withNote("Sell order +" + Ticks.percent(sellMarkup) + "% over buy " + buy.orderId())
                .closingBuy(buy.orderId());
    }
}
