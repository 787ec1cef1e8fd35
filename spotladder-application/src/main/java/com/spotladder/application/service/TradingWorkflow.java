package com.spotladder.application.service;

import com.spotladder.application.exchange.ExchangePort;
import com.spotladder.application.ports.OrderLedgerPort;
import com.spotladder.domain.order.InsufficientFundsException;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import com.spotladder.domain.order.PriceConstraintException;
import com.spotladder.domain.order.Ticks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for the two operating modes on one symbol: the scripted buy ladder and the single actions
 * offered by the interactive menu.
 *
 * <p>Every confirmed placement is appended to the ledger and followed by a reconciliation pass, in every
 * mode. Domain preconditions (price ceiling, balance) are checked before anything is sent to the exchange.
 */
public final class TradingWorkflow {

    private static final Logger log = LoggerFactory.getLogger(TradingWorkflow.class);

    private final ExchangePort exchange;
    private final OrderLedgerPort ledger;
    private final ReconciliationService reconciliation;
    private final TradingPolicy policy;
    private final String symbol;

    public TradingWorkflow(ExchangePort exchange,
                           OrderLedgerPort ledger,
                           ReconciliationService reconciliation,
                           TradingPolicy policy,
                           String symbol) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.reconciliation = Objects.requireNonNull(reconciliation, "reconciliation");
        this.policy = Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.isBlank()) throw new IllegalArgumentException("symbol is blank");
        this.symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public String symbol() {
        return symbol;
    }

    public TradingPolicy policy() {
        return policy;
    }

    /**
     * Scripted mode: one buy per configured discount below the best bid, all funded up front.
     *
     * @throws IllegalArgumentException   when {@code amount} is missing or not positive
     * @throws PriceConstraintException   when the best bid is at or above the ceiling (nothing placed)
     * @throws InsufficientFundsException when the balance cannot cover the whole ladder (nothing placed)
     */
    public LadderResult runAuto(BigDecimal amount) {
        BigDecimal qty = requirePositive(amount);

        String currency = policy.quoteCurrency();
        BigDecimal available = exchange.availableBalance(currency);
        log.info("Available {}: {}", currency, available.toPlainString());

        BigDecimal bestBid = exchange.highestBid(symbol);
        log.info("Highest bid for {}: {}", symbol, bestBid.toPlainString());

        if (bestBid.compareTo(policy.maxPrice()) >= 0) {
            throw new PriceConstraintException(symbol, bestBid, policy.maxPrice());
        }

        List<BigDecimal> prices = new ArrayList<>();
        BigDecimal required = BigDecimal.ZERO;
        for (BigDecimal discount : policy.autoDiscounts()) {
            BigDecimal price = Ticks.discounted(bestBid, discount);
            prices.add(price);
            required = required.add(price.multiply(qty));
        }
        if (available.compareTo(required) < 0) {
            throw new InsufficientFundsException(currency, available, required);
        }

        List<OrderRecord> placed = new ArrayList<>();
        try {
            for (int i = 0; i < prices.size(); i++) {
                placed.add(placeBuy(prices.get(i), policy.autoDiscounts().get(i), qty));
            }
        } catch (RuntimeException e) {
            if (!placed.isEmpty()) {
                log.warn("Placement failed after {} confirmed order(s); recording them before propagating", placed.size());
                ledger.append(placed);
            }
            throw e;
        }
        ledger.append(placed);
        log.info("Stored {} buy order(s)", placed.size());

        ReconciliationReport report = reconciliation.reconcile();
        return new LadderResult(bestBid, required, placed, report);
    }

    /**
     * Interactive mode: a single buy {@code discount} below the current best bid, recorded and reconciled.
     */
    public OrderRecord placeDiscountedBuy(BigDecimal discount, BigDecimal amount) {
        Objects.requireNonNull(discount, "discount");
        BigDecimal qty = requirePositive(amount);

        BigDecimal bestBid = exchange.highestBid(symbol);
        OrderRecord record = placeBuy(Ticks.discounted(bestBid, discount), discount, qty);
        ledger.append(List.of(record));
        reconciliation.reconcile();
        return record;
    }

    /**
     * Cancels on the exchange, then mirrors the reported status into the ledger when the record is known
     * and the transition is allowed.
     */
    public CancelOutcome cancel(String orderId) {
        Objects.requireNonNull(orderId, "orderId");
        String id = orderId.trim();
        if (id.isEmpty()) throw new IllegalArgumentException("orderId is blank");

        OrderStatus remote = exchange.cancelOrder(id);

        List<OrderRecord> orders = new ArrayList<>(ledger.load());
        boolean updated = false;
        boolean found = false;
        for (OrderRecord order : orders) {
            if (!order.orderId().equals(id)) continue;
            found = true;
            if (!order.status().canTransitionTo(remote)) {
                log.warn("Order {} is {} locally; ignoring reported {}", id, order.status(), remote);
                continue;
            }
            updated |= order.transitionTo(remote);
        }
        if (updated) {
            ledger.save(orders);
            log.info("Order {} status updated to {}", id, remote);
        } else if (!found) {
            log.warn("Order {} canceled on the exchange but not present in the local ledger", id);
        }
        return new CancelOutcome(id, remote, updated);
    }

    public MarketSnapshot snapshot() {
        String currency = policy.quoteCurrency();
        return new MarketSnapshot(symbol, currency,
                exchange.availableBalance(currency),
                exchange.highestBid(symbol),
                exchange.lowestAsk(symbol));
    }

    /** Last {@code limit} ledger records, oldest first. */
    public List<OrderRecord> recentOrders(int limit) {
        List<OrderRecord> all = ledger.load();
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public List<OrderRecord> allOrders() {
        return List.copyOf(ledger.load());
    }

    public ReconciliationReport sync() {
        return reconciliation.reconcile();
    }

    private OrderRecord placeBuy(BigDecimal price, BigDecimal discount, BigDecimal qty) {
        OrderRecord placed = exchange.createLimitOrder(symbol, OrderSide.BUY, qty, price)
                .withNote("Buy order " + Ticks.percent(discount) + "% below best bid");
        log.info("Created buy order {} at {} ({}% discount)",
                placed.orderId(), placed.price().toPlainString(), Ticks.percent(discount));
        return placed;
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("An amount is required");
        }
        BigDecimal qty = Ticks.quantize(amount);
        if (qty.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero: " + amount.toPlainString());
        }
        return qty;
    }
}
