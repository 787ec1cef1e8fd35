package com.spotladder.application.exchange;

import java.util.Locale;
import java.util.Objects;

/**
 * Trading pair as BASE/QUOTE (e.g. LTC/USDT).
 *
 * Exchange adapters map this to whatever spelling the venue accepts (LTCUSDT, LTC-USDT, LTC/USDT, ltcusdt).
 */
public final class MarketSymbol {

    /** Quote length assumed when a concatenated symbol has to be split without exchange metadata. */
    public static final int GUESSED_QUOTE_LENGTH = 4;

    private final String base;
    private final String quote;

    public MarketSymbol(String base, String quote) {
        this.base = normalizeToken(base);
        this.quote = normalizeToken(quote);
    }

    public static MarketSymbol of(String base, String quote) {
        return new MarketSymbol(base, quote);
    }

    /**
     * Parses strings like "LTC/USDT", "ltc-usdt", "LTC_USDT".
     */
    public static MarketSymbol parse(String value) {
        Objects.requireNonNull(value, "value");
        String v = value.trim().replace('-', '/').replace('_', '/');
        String[] parts = v.split("/");
        if (parts.length != 2) throw new IllegalArgumentException("Unsupported symbol format: " + value);
        return new MarketSymbol(parts[0], parts[1]);
    }

    /**
     * Splits a symbol without any exchange metadata: separators win, otherwise the trailing four characters
     * are taken as the quote (USDT, USDC, ...).
     */
    public static MarketSymbol guess(String value) {
        Objects.requireNonNull(value, "value");
        String v = value.trim();
        if (v.contains("/") || v.contains("-") || v.contains("_")) {
            return parse(v);
        }
        String key = key(v);
        if (key.length() <= GUESSED_QUOTE_LENGTH) {
            throw new IllegalArgumentException("Cannot split symbol into base and quote: " + value);
        }
        int cut = key.length() - GUESSED_QUOTE_LENGTH;
        return new MarketSymbol(key.substring(0, cut), key.substring(cut));
    }

    /**
     * Normalized lookup key: uppercase letters and digits only. "ltc-usdt", "LTC/USDT" and "LTCUSDT" share a key.
     */
    public static String key(String name) {
        if (name == null) return "";
        StringBuilder sb = new StringBuilder(name.length());
        for (char ch : name.toUpperCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(ch)) sb.append(ch);
        }
        return sb.toString();
    }

    public String base() { return base; }

    public String quote() { return quote; }

    @Override
    public String toString() {
        return base + "/" + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarketSymbol other)) return false;
        return base.equals(other.base) && quote.equals(other.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote);
    }

    private static String normalizeToken(String t) {
        Objects.requireNonNull(t, "token");
        String v = t.trim();
        if (v.isEmpty()) throw new IllegalArgumentException("Empty token");
        return v.toUpperCase(Locale.ROOT);
    }
}
