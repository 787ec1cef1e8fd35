package com.spotladder.application.service;

import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.config.DecimalList;
import com.spotladder.application.ports.ConfigPort;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Trading constants of the ladder workflow.
 *
 * @param quoteCurrency  currency whose balance funds the buys
 * @param maxPrice       the auto ladder refuses to run when the best bid is at or above this
 * @param autoDiscounts  fractions below the best bid, one buy each, for the auto ladder
 * @param menuDiscounts  fractions offered by the interactive menu
 * @param sellMarkup     fraction above the buy price for the linked sell
 */
public record TradingPolicy(String quoteCurrency,
                            BigDecimal maxPrice,
                            List<BigDecimal> autoDiscounts,
                            List<BigDecimal> menuDiscounts,
                            BigDecimal sellMarkup) {

    public TradingPolicy {
        Objects.requireNonNull(quoteCurrency, "quoteCurrency");
        if (quoteCurrency.isBlank()) throw new IllegalArgumentException("quoteCurrency is blank");
        quoteCurrency = quoteCurrency.trim().toUpperCase(Locale.ROOT);
        Objects.requireNonNull(maxPrice, "maxPrice");
        Objects.requireNonNull(sellMarkup, "sellMarkup");
        autoDiscounts = checkedFractions(autoDiscounts, "autoDiscounts");
        menuDiscounts = checkedFractions(menuDiscounts, "menuDiscounts");
        if (sellMarkup.signum() < 0) throw new IllegalArgumentException("sellMarkup must be >= 0");
    }

    public static TradingPolicy defaults() {
        return new TradingPolicy(
                ConfigKey.TRADE_QUOTE_CURRENCY.defaultValue(),
                new BigDecimal(ConfigKey.TRADE_MAX_PRICE.defaultValue()),
                DecimalList.parse(ConfigKey.TRADE_AUTO_DISCOUNTS.defaultValue()),
                DecimalList.parse(ConfigKey.TRADE_MENU_DISCOUNTS.defaultValue()),
                new BigDecimal(ConfigKey.TRADE_SELL_MARKUP.defaultValue()));
    }

    public static TradingPolicy fromConfig(ConfigPort config) {
        return new TradingPolicy(
                config.get(ConfigKey.TRADE_QUOTE_CURRENCY.key(), ConfigKey.TRADE_QUOTE_CURRENCY.defaultValue()),
                decimal(config, ConfigKey.TRADE_MAX_PRICE),
                DecimalList.parse(config.get(ConfigKey.TRADE_AUTO_DISCOUNTS.key(), ConfigKey.TRADE_AUTO_DISCOUNTS.defaultValue())),
                DecimalList.parse(config.get(ConfigKey.TRADE_MENU_DISCOUNTS.key(), ConfigKey.TRADE_MENU_DISCOUNTS.defaultValue())),
                decimal(config, ConfigKey.TRADE_SELL_MARKUP));
    }

    private static BigDecimal decimal(ConfigPort config, ConfigKey key) {
        return config.getDecimal(key.key(), new BigDecimal(key.defaultValue()));
    }

    private static List<BigDecimal> checkedFractions(List<BigDecimal> values, String name) {
        Objects.requireNonNull(values, name);
        if (values.isEmpty()) throw new IllegalArgumentException(name + " is empty");
        for (BigDecimal v : values) {
            if (v == null || v.signum() < 0 || v.compareTo(BigDecimal.ONE) >= 0) {
                throw new IllegalArgumentException(name + " must be fractions in [0, 1): " + values);
            }
        }
        return List.copyOf(values);
    }
}
