package com.spotladder.application.config;

/**
 * Known configuration keys.
 * Secrets are read from secrets.properties or the environment, never from config.properties defaults.
 */
public enum ConfigKey {
    EXCHANGE("exchange", false, true, "ATAIX"),

    ATAIX_BASE_URL("ataix.baseUrl", false, true, "https://api.ataix.kz/api"),
    ATAIX_TIMEOUT_SECONDS("ataix.timeoutSeconds", false, true, "20"),
    ATAIX_API_KEY("ATAIX_API_KEY", true, false, null),
    ATAIX_API_SECRET("ATAIX_API_SECRET", true, true, null),
    ATAIX_SYMBOL_FORMAT("ATAIX_SYMBOL_FORMAT", false, true, null),
    ATAIX_ORDER_SIZE_FIELD("ATAIX_ORDER_SIZE_FIELD", false, true, null),

    TRADE_SYMBOL("trade.symbol", false, true, "LTCUSDT"),
    TRADE_QUOTE_CURRENCY("trade.quoteCurrency", false, true, "USDT"),
    TRADE_MAX_PRICE("trade.maxPrice", false, true, "0.6"),
    TRADE_AUTO_DISCOUNTS("trade.autoDiscounts", false, true, "0.02,0.05,0.08"),
    TRADE_MENU_DISCOUNTS("trade.menuDiscounts", false, true, "0.02,0.04,0.06"),
    TRADE_SELL_MARKUP("trade.sellMarkup", false, true, "0.02"),

    LEDGER_FILE("ledger.file", false, true, "orders.json"),

    PAPER_BALANCE("paper.balance", false, true, "1000"),
    PAPER_BID("paper.bid", false, true, "0.5"),
    PAPER_ASK("paper.ask", false, true, "0.51"),
    PAPER_INITIAL_STATUS("paper.initialStatus", false, true, "NEW");

    private final String key;
    private final boolean secret;
    private final boolean optional;
    private final String defaultValue;

    ConfigKey(String key, boolean secret, boolean optional, String defaultValue) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
    public String defaultValue() { return defaultValue; }
}
