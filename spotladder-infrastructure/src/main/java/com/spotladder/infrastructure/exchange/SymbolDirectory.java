package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotladder.application.exchange.MarketSymbol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Process-lifetime cache of pair spellings seen in the price feed, owned by one gateway instance.
 * Used to rebuild base/quote when an order for the same pair is placed later.
 */
public final class SymbolDirectory {

    private final Map<String, SymbolInfo> byKey = new HashMap<>();

    public void remember(JsonNode entry) {
        if (entry == null || !entry.isObject()) return;
        String name = firstText(entry, "symbol", "symbolCode");
        if (name == null) name = "";
        String key = MarketSymbol.key(name);
        if (key.isEmpty()) return;

        String base = firstText(entry, "baseCurrency", "baseCurrencyCode");
        String quote = firstText(entry, "quoteCurrency", "quoteCurrencyCode");
        if (base == null || quote == null) {
            String clean = name.replace('-', '/').replace('_', '/');
            String[] parts = clean.split("/");
            if (parts.length == 2) {
                if (base == null) base = parts[0];
                if (quote == null) quote = parts[1];
            }
        }
        byKey.put(key, new SymbolInfo(key, upper(base), upper(quote), name));
    }

    public Optional<SymbolInfo> lookup(String symbol) {
        return Optional.ofNullable(byKey.get(MarketSymbol.key(symbol)));
    }

    /**
     * Base/quote for {@code symbol}: from the cache when known, otherwise the trailing four characters of
     * the normalized symbol are taken as the quote.
     */
    public MarketSymbol resolve(String symbol) {
        Optional<SymbolInfo> info = lookup(symbol);
        if (info.isPresent() && info.get().complete()) {
            return MarketSymbol.of(info.get().base(), info.get().quote());
        }
        return MarketSymbol.guess(MarketSymbol.key(symbol));
    }

    private static String upper(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }

    static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && !v.isNull() && !v.isContainerNode() && !v.asText().isBlank()) {
                return v.asText();
            }
        }
        return null;
    }
}
