package com.spotladder.domain.order;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    /** Lowercase form used on the wire and in the ledger file. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrderSide fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order side is empty");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> throw new IllegalArgumentException("Unsupported order side: " + value);
        };
    }
}
