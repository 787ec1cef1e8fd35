package com.spotladder.infrastructure.exchange;

/**
 * What the price feed told us about a pair.
 *
 * @param key   normalized pair key (uppercase alphanumerics)
 * @param base  base currency, may be empty when the feed did not say
 * @param quote quote currency, may be empty when the feed did not say
 * @param raw   spelling last observed in the feed
 */
public record SymbolInfo(String key, String base, String quote, String raw) {

    public boolean complete() {
        return !base.isBlank() && !quote.isBlank();
    }
}
