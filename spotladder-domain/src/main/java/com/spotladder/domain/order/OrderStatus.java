package com.spotladder.domain.order;

import java.util.Locale;

/**
 * Local view of an order's lifecycle.
 *
 * <pre>
 *   NEW -> FILLED | CANCELED | REJECTED | UNKNOWN
 *   UNKNOWN -> any
 * </pre>
 *
 * FILLED, CANCELED and REJECTED are terminal. UNKNOWN means the exchange could not tell us
 * and the order is polled again on the next run.
 */
public enum OrderStatus {
    NEW(false),
    FILLED(true),
    CANCELED(true),
    REJECTED(true),
    UNKNOWN(false);

    private final boolean terminal;

    OrderStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(OrderStatus next) {
        if (next == null) return false;
        if (next == this) return true;
        return !terminal;
    }

    /**
     * Maps the many spellings exchanges use onto the local states.
     * Partially filled orders are still open, so they stay NEW.
     */
    public static OrderStatus fromWire(String value) {
        if (value == null) return UNKNOWN;
        String v = value.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "NEW", "OPEN", "PENDING", "PARTIALLY_FILLED", "PARTIALLY FILLED", "PARTIALLYFILLED" -> NEW;
            case "FILLED", "DONE", "CLOSED" -> FILLED;
            case "CANCELED", "CANCELLED", "EXPIRED" -> CANCELED;
            case "REJECTED" -> REJECTED;
            default -> UNKNOWN;
        };
    }
}
