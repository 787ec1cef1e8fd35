package com.spotladder.application.exchange;

import java.util.Locale;
import java.util.Optional;

/**
 * Symbol spellings tried when the venue's expected format is not known up front.
 */
public enum SymbolFormat {
    DASH,
    SLASH,
    UPPER,
    LOWER;

    public String format(MarketSymbol symbol) {
        return switch (this) {
            case DASH -> symbol.base() + "-" + symbol.quote();
            case SLASH -> symbol.base() + "/" + symbol.quote();
            case UPPER -> symbol.base() + symbol.quote();
            case LOWER -> (symbol.base() + symbol.quote()).toLowerCase(Locale.ROOT);
        };
    }

    /** Case-insensitive lookup; empty for blank or unknown names. */
    public static Optional<SymbolFormat> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (SymbolFormat f : values()) {
            if (f.name().equals(n)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
