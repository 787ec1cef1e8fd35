package com.spotladder.application.config;

import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.application.ports.ConfigPort;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Offline sanity checks for a loaded configuration. Makes no network calls.
 */
public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        ExchangeId exchange = null;
        String rawExchange = config.get(ConfigKey.EXCHANGE.key(), ConfigKey.EXCHANGE.defaultValue());
        try {
            exchange = ExchangeId.valueOf(rawExchange.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            res.addError("Unknown exchange: " + rawExchange);
        }

        // PAPER needs no credentials.
        if (exchange != ExchangeId.PAPER) {
            for (ConfigKey k : ConfigKey.values()) {
                if (k.isOptional()) continue;
                String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
                if (v == null || v.isBlank()) {
                    res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
                }
            }
        }

        String url = config.get(ConfigKey.ATAIX_BASE_URL.key(), ConfigKey.ATAIX_BASE_URL.defaultValue());
        if (!(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError(ConfigKey.ATAIX_BASE_URL.key() + " must start with http:// or https://");
        }

        checkDecimal(config, ConfigKey.TRADE_MAX_PRICE, res);
        checkDecimal(config, ConfigKey.TRADE_SELL_MARKUP, res);
        checkDecimal(config, ConfigKey.PAPER_BALANCE, res);
        checkDecimal(config, ConfigKey.PAPER_BID, res);
        checkDecimal(config, ConfigKey.PAPER_ASK, res);
        checkDecimalList(config, ConfigKey.TRADE_AUTO_DISCOUNTS, res);
        checkDecimalList(config, ConfigKey.TRADE_MENU_DISCOUNTS, res);

        return res;
    }

    private static void checkDecimal(ConfigPort config, ConfigKey key, ConfigValidationResult res) {
        String v = config.get(key.key(), key.defaultValue());
        try {
            new BigDecimal(v.trim());
        } catch (NumberFormatException e) {
            res.addError(key.key() + " is not a decimal: " + v);
        }
    }

    private static void checkDecimalList(ConfigPort config, ConfigKey key, ConfigValidationResult res) {
        String v = config.get(key.key(), key.defaultValue());
        try {
            DecimalList.parse(v);
        } catch (IllegalArgumentException e) {
            res.addError(key.key() + ": " + e.getMessage());
        }
    }
}
