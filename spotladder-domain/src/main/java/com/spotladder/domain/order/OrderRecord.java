package com.spotladder.domain.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One order this workflow placed, as kept in the local ledger.
 *
 * <p>Identity, side, amount and price never change after placement. Only the status moves (see
 * {@link OrderStatus}) and a filled buy is linked to the sell that closes it out, once.
 */
public final class OrderRecord {

    private final String orderId;
    private final String symbol;
    private final OrderSide side;
    private final BigDecimal amount;
    private final BigDecimal price;
    private final Instant createdAt;
    private final String note;

    private OrderStatus status;
    private String linkedOrderId;

    public OrderRecord(String orderId,
                       String symbol,
                       OrderSide side,
                       BigDecimal amount,
                       BigDecimal price,
                       OrderStatus status,
                       Instant createdAt,
                       String note,
                       String linkedOrderId) {
        this.orderId = requireText(orderId, "orderId");
        this.symbol = requireText(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.amount = Ticks.quantize(Objects.requireNonNull(amount, "amount"));
        this.price = Ticks.quantize(Objects.requireNonNull(price, "price"));
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt").truncatedTo(ChronoUnit.SECONDS);
        this.note = blankToNull(note);
        this.linkedOrderId = blankToNull(linkedOrderId);
    }

    /** A freshly acknowledged order: no note, no link. */
    public static OrderRecord placed(String orderId,
                                     String symbol,
                                     OrderSide side,
                                     BigDecimal amount,
                                     BigDecimal price,
                                     OrderStatus status,
                                     Instant createdAt) {
        return new OrderRecord(orderId, symbol, side, amount, price, status, createdAt, null, null);
    }

    public OrderRecord withNote(String newNote) {
        return new OrderRecord(orderId, symbol, side, amount, price, status, createdAt, newNote, linkedOrderId);
    }

    /** Sell-side back-reference to the buy this sell closes out. */
    public OrderRecord closingBuy(String buyOrderId) {
        if (side != OrderSide.SELL) {
            throw new IllegalStateException("Only a sell can reference the buy it closes: " + orderId);
        }
        return new OrderRecord(orderId, symbol, side, amount, price, status, createdAt, note, requireText(buyOrderId, "buyOrderId"));
    }

    /**
     * Moves to {@code next}.
     *
     * @return true when the status actually changed
     * @throws IllegalStateException when the current status is terminal and {@code next} differs
     */
    public boolean transitionTo(OrderStatus next) {
        Objects.requireNonNull(next, "next");
        if (next == status) return false;
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Order " + orderId + " is " + status + " and cannot become " + next);
        }
        status = next;
        return true;
    }

    /** True for a filled buy that still has no linked sell. */
    public boolean awaitsLinkedSell() {
        return side == OrderSide.BUY && status == OrderStatus.FILLED && linkedOrderId == null;
    }

    /**
     * Links a filled buy to the sell placed for it. Allowed exactly once.
     */
    public void linkTo(String sellOrderId) {
        requireText(sellOrderId, "sellOrderId");
        if (side != OrderSide.BUY) {
            throw new IllegalStateException("Only buy orders get a linked sell: " + orderId);
        }
        if (status != OrderStatus.FILLED) {
            throw new IllegalStateException("Buy " + orderId + " is " + status + ", not FILLED");
        }
        if (linkedOrderId != null) {
            throw new IllegalStateException("Buy " + orderId + " is already linked to " + linkedOrderId);
        }
        linkedOrderId = sellOrderId;
    }

    public String orderId() { return orderId; }
    public String symbol() { return symbol; }
    public OrderSide side() { return side; }
    public BigDecimal amount() { return amount; }
    public BigDecimal price() { return price; }
    public OrderStatus status() { return status; }
    public Instant createdAt() { return createdAt; }
    public String note() { return note; }
    public String linkedOrderId() { return linkedOrderId; }

    public boolean isLinked() {
        return linkedOrderId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderRecord other)) return false;
        return orderId.equals(other.orderId)
                && symbol.equals(other.symbol)
                && side == other.side
                && amount.equals(other.amount)
                && price.equals(other.price)
                && status == other.status
                && createdAt.equals(other.createdAt)
                && Objects.equals(note, other.note)
                && Objects.equals(linkedOrderId, other.linkedOrderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, symbol, side, amount, price, status, createdAt, note, linkedOrderId);
    }

    @Override
    public String toString() {
        return "OrderRecord{" + orderId + " " + side.wireName() + " " + symbol
                + " " + amount.toPlainString() + "@" + price.toPlainString()
                + " " + status + (linkedOrderId == null ? "" : " -> " + linkedOrderId) + "}";
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) throw new IllegalArgumentException(name + " is blank");
        return value.trim();
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
