package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.exchange.MarketSymbol;
import com.spotladder.application.exchange.RejectionKind;
import com.spotladder.application.exchange.SymbolFormat;
import com.spotladder.application.ports.ConfigPort;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.Ticks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Finds the order request shape the venue accepts by walking symbol spellings and size-field names.
 *
 * <p>An unrecognized-parameter rejection moves to the next size field of the same spelling, an
 * invalid-symbol rejection moves to the next spelling. Anything else, or running out of candidates,
 * surfaces the last rejection. At most {@code formats x sizeFields} requests are sent per order.
 */
public final class OrderPlacementNegotiator {

    private static final Logger log = LoggerFactory.getLogger(OrderPlacementNegotiator.class);

    public static final List<SymbolFormat> DEFAULT_FORMATS =
            List.of(SymbolFormat.DASH, SymbolFormat.SLASH, SymbolFormat.UPPER, SymbolFormat.LOWER);
    public static final List<String> DEFAULT_SIZE_FIELDS = List.of("quantity", "amount", "volume");

    private final List<SymbolFormat> formats;
    private final List<String> sizeFields;

    public OrderPlacementNegotiator(List<SymbolFormat> formats, List<String> sizeFields) {
        this.formats = List.copyOf(new LinkedHashSet<>(formats.isEmpty() ? DEFAULT_FORMATS : formats));
        this.sizeFields = List.copyOf(new LinkedHashSet<>(sizeFields.isEmpty() ? DEFAULT_SIZE_FIELDS : sizeFields));
    }

    public static OrderPlacementNegotiator defaults() {
        return new OrderPlacementNegotiator(DEFAULT_FORMATS, DEFAULT_SIZE_FIELDS);
    }

    /**
     * Candidates with the optional overrides tried first. An unknown format name is ignored.
     */
    public static OrderPlacementNegotiator withOverrides(String formatOverride, String sizeFieldOverride) {
        List<SymbolFormat> formats = new ArrayList<>();
        SymbolFormat.lookup(formatOverride).ifPresentOrElse(formats::add, () -> {
            if (formatOverride != null && !formatOverride.isBlank()) {
                log.warn("Ignoring unknown symbol format override '{}'", formatOverride);
            }
        });
        formats.addAll(DEFAULT_FORMATS);

        List<String> fields = new ArrayList<>();
        if (sizeFieldOverride != null && !sizeFieldOverride.isBlank()) {
            fields.add(sizeFieldOverride.trim().toLowerCase(Locale.ROOT));
        }
        fields.addAll(DEFAULT_SIZE_FIELDS);
        return new OrderPlacementNegotiator(formats, fields);
    }

    public static OrderPlacementNegotiator fromConfig(ConfigPort config) {
        return withOverrides(config.get(ConfigKey.ATAIX_SYMBOL_FORMAT.key()),
                config.get(ConfigKey.ATAIX_ORDER_SIZE_FIELD.key()));
    }

    public List<SymbolFormat> formats() {
        return formats;
    }

    public List<String> sizeFields() {
        return sizeFields;
    }

    public JsonNode place(AtaixTransport transport, MarketSymbol pair, OrderSide side, BigDecimal amount, BigDecimal price) {
        String qty = Ticks.quantize(amount).toPlainString();
        String px = Ticks.quantize(price).toPlainString();

        for (int f = 0; f < formats.size(); f++) {
            String spelled = formats.get(f).format(pair);
            boolean moreFormats = f < formats.size() - 1;

            for (int s = 0; s < sizeFields.size(); s++) {
                String field = sizeFields.get(s);
                ObjectNode body = JsonNodeFactory.instance.objectNode();
                body.put("symbol", spelled);
                body.put("side", side.wireName());
                body.put("type", "limit");
                body.put("price", px);
                body.put(field, qty);

                try {
                    return transport.request("POST", "/orders", body);
                } catch (GatewayException e) {
                    if (e.kind() == RejectionKind.UNRECOGNIZED_PARAMETER && s < sizeFields.size() - 1) {
                        log.info("Size field '{}' rejected for {}, trying next", field, spelled);
                        continue;
                    }
                    if (e.kind() == RejectionKind.INVALID_SYMBOL && moreFormats) {
                        log.info("Symbol spelling '{}' rejected, trying next", spelled);
                        break;
                    }
                    throw e;
                }
            }
        }
        throw new GatewayException(RejectionKind.INVALID_SYMBOL, "No accepted symbol spelling for " + pair);
    }
}
