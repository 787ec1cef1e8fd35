package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.application.exchange.ExchangePort;
import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.exchange.MarketSymbol;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import com.spotladder.domain.order.Ticks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ExchangePort for the live ATAIX venue.
 *
 * <p>Response fields are read by preference lists because the venue is not consistent about naming.
 * Pair spellings seen in the price feed are cached in a {@link SymbolDirectory} owned by this instance.
 */
public final class AtaixExchangeAdapter implements ExchangePort {

    private static final Logger log = LoggerFactory.getLogger(AtaixExchangeAdapter.class);

    private static final String[] BALANCE_FIELDS = {"available", "balance", "amount"};
    private static final String[] BID_FIELDS = {"bid", "buy", "highestBid"};
    private static final String[] ASK_FIELDS = {"ask", "sell", "lowestAsk"};
    private static final String[] ORDER_ID_FIELDS = {"orderId", "orderID", "id", "order_id"};
    private static final String[] STATUS_FIELDS = {"orderStatus", "status", "state"};

    private final AtaixTransport transport;
    private final OrderPlacementNegotiator negotiator;
    private final SymbolDirectory symbols;
    private final Clock clock;

    public AtaixExchangeAdapter(AtaixTransport transport, OrderPlacementNegotiator negotiator, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.negotiator = Objects.requireNonNull(negotiator, "negotiator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.symbols = new SymbolDirectory();
    }

    @Override
    public ExchangeId id() {
        return ExchangeId.ATAIX;
    }

    SymbolDirectory symbols() {
        return symbols;
    }

    @Override
    public BigDecimal availableBalance(String currency) {
        String cur = currency.trim().toUpperCase(Locale.ROOT);
        JsonNode payload = transport.request("GET", "/user/balances/" + encode(cur), null);
        if (payload != null && payload.isObject()) {
            for (String field : BALANCE_FIELDS) {
                JsonNode v = payload.get(field);
                if (v != null && !v.isNull()) {
                    return decimal(v, "balance of " + cur);
                }
            }
        }
        throw new GatewayException("Balance payload for " + cur + " lacks an available amount: " + payload);
    }

    @Override
    public BigDecimal highestBid(String symbol) {
        BigDecimal best = null;
        for (JsonNode entry : priceEntries(symbol)) {
            BigDecimal v = firstDecimal(entry, BID_FIELDS);
            if (v != null && (best == null || v.compareTo(best) > 0)) best = v;
        }
        if (best == null) throw new GatewayException("Cannot determine highest bid for " + symbol);
        return best;
    }

    @Override
    public BigDecimal lowestAsk(String symbol) {
        BigDecimal best = null;
        for (JsonNode entry : priceEntries(symbol)) {
            BigDecimal v = firstDecimal(entry, ASK_FIELDS);
            if (v != null && (best == null || v.compareTo(best) < 0)) best = v;
        }
        if (best == null) throw new GatewayException("Cannot determine lowest ask for " + symbol);
        return best;
    }

    @Override
    public OrderRecord createLimitOrder(String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
        BigDecimal qty = Ticks.quantize(amount);
        BigDecimal px = Ticks.quantize(price);
        MarketSymbol pair = symbols.resolve(symbol);

        JsonNode response = negotiator.place(transport, pair, side, qty, px);
        JsonNode details = unwrap(response);

        String orderId = SymbolDirectory.firstText(details, ORDER_ID_FIELDS);
        if (orderId == null) {
            throw new GatewayException("Order response lacks an order id: " + response);
        }
        JsonNode status = details.get("status");
        OrderStatus initial = status != null && status.isTextual() ? OrderStatus.fromWire(status.asText()) : OrderStatus.NEW;

        log.info("ATAIX accepted {} {} {} @ {} as {}", side.wireName(), qty.toPlainString(), pair,
                px.toPlainString(), orderId);
        return OrderRecord.placed(orderId, symbol.trim().toUpperCase(Locale.ROOT), side, qty, px, initial, clock.instant());
    }

    @Override
    public OrderStatus orderStatus(String orderId) {
        JsonNode details = unwrap(transport.request("GET", "/orders/" + encode(orderId), null));
        for (String field : STATUS_FIELDS) {
            JsonNode v = details.get(field);
            if (v != null && v.isTextual()) {
                return OrderStatus.fromWire(v.asText());
            }
        }
        throw new GatewayException("Cannot determine status of order " + orderId + ": " + details);
    }

    @Override
    public OrderStatus cancelOrder(String orderId) {
        JsonNode response = transport.request("DELETE", "/orders/" + encode(orderId), null);
        JsonNode details = response != null && response.isObject() && response.has("result")
                ? response.get("result")
                : response;
        // an accepted cancel may carry no order details at all
        if (details == null || !details.isObject()) {
            return OrderStatus.CANCELED;
        }
        JsonNode status = details.get("status");
        if (status != null && status.isTextual()) {
            return OrderStatus.fromWire(status.asText());
        }
        return OrderStatus.CANCELED;
    }

    private List<JsonNode> priceEntries(String symbol) {
        String target = MarketSymbol.key(symbol);
        JsonNode payload = unwrap(transport.request("GET", "/prices", null));

        List<JsonNode> candidates = new ArrayList<>();
        if (payload.isArray()) {
            payload.forEach(candidates::add);
        } else if (payload.isObject()) {
            candidates.add(payload);
        }

        List<JsonNode> matches = new ArrayList<>();
        for (JsonNode entry : candidates) {
            if (!entry.isObject()) continue;
            if (matches(entry, target)) {
                symbols.remember(entry);
                matches.add(entry);
            }
        }
        return matches;
    }

    private static boolean matches(JsonNode entry, String target) {
        String symbol = text(entry, "symbol");
        String code = text(entry, "symbolCode");
        String pair = text(entry, "baseCurrency") + text(entry, "quoteCurrency");
        return target.equals(MarketSymbol.key(symbol))
                || target.equals(MarketSymbol.key(code))
                || target.equals(MarketSymbol.key(pair));
    }

    private static JsonNode unwrap(JsonNode node) {
        if (node != null && node.isObject() && node.has("result") && !node.get("result").isNull()) {
            return node.get("result");
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new GatewayException("Empty response from exchange");
        }
        return node;
    }

    private static BigDecimal firstDecimal(JsonNode entry, String... fields) {
        for (String f : fields) {
            JsonNode v = entry.get(f);
            if (v == null || v.isNull() || v.isContainerNode()) continue;
            if (v.isTextual() && v.asText().isBlank()) continue;
            return decimal(v, f);
        }
        return null;
    }

    private static BigDecimal decimal(JsonNode v, String what) {
        try {
            return v.isNumber() ? v.decimalValue() : new BigDecimal(v.asText().trim());
        } catch (NumberFormatException e) {
            throw new GatewayException("Not a number for " + what + ": " + v, e);
        }
    }

    private static String text(JsonNode entry, String field) {
        JsonNode v = entry.get(field);
        return v == null || v.isNull() ? "" : v.asText();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment.trim(), StandardCharsets.UTF_8);
    }
}
