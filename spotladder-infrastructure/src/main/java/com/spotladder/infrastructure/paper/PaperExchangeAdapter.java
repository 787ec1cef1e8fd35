package com.spotladder.infrastructure.paper;

import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.application.exchange.ExchangePort;
import com.spotladder.application.ports.ConfigPort;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import com.spotladder.domain.order.Ticks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PAPER exchange adapter.
 *
 * <p>Never talks to a venue: balance and quotes are fixed, orders live in a {@link PaperBrokerState}
 * and only change status when a test or the operator says so ({@link #fill}, {@link #setStatus}).
 * Order ids carry a {@code dry-} prefix so they cannot be mistaken for live ones in the ledger.
 */
public final class PaperExchangeAdapter implements ExchangePort {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeAdapter.class);

    public static final String ID_PREFIX = "dry-";

    private final PaperBrokerState state;
    private final BigDecimal balance;
    private final BigDecimal bid;
    private final BigDecimal ask;
    private final OrderStatus initialStatus;
    private final Supplier<String> ids;
    private final Clock clock;

    public PaperExchangeAdapter(PaperBrokerState state,
                                BigDecimal balance,
                                BigDecimal bid,
                                BigDecimal ask,
                                OrderStatus initialStatus,
                                Supplier<String> ids,
                                Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.balance = Objects.requireNonNull(balance, "balance");
        this.bid = Objects.requireNonNull(bid, "bid");
        this.ask = Objects.requireNonNull(ask, "ask");
        this.initialStatus = Objects.requireNonNull(initialStatus, "initialStatus");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static PaperExchangeAdapter fromConfig(ConfigPort config, Clock clock) {
        return new PaperExchangeAdapter(new PaperBrokerState(),
                decimal(config, ConfigKey.PAPER_BALANCE),
                decimal(config, ConfigKey.PAPER_BID),
                decimal(config, ConfigKey.PAPER_ASK),
                OrderStatus.fromWire(config.get(ConfigKey.PAPER_INITIAL_STATUS.key(),
                        ConfigKey.PAPER_INITIAL_STATUS.defaultValue())),
                () -> UUID.randomUUID().toString().replace("-", ""),
                clock);
    }

    @Override
    public ExchangeId id() {
        return ExchangeId.PAPER;
    }

    @Override
    public BigDecimal availableBalance(String currency) {
        return balance;
    }

    @Override
    public BigDecimal highestBid(String symbol) {
        return bid;
    }

    @Override
    public BigDecimal lowestAsk(String symbol) {
        return ask;
    }

    @Override
    public OrderRecord createLimitOrder(String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
        String orderId = ID_PREFIX + ids.get();
        state.put(orderId, initialStatus);
        log.info("[PAPER] {} {} {} @ {} -> {}", side.wireName(), Ticks.quantize(amount).toPlainString(),
                symbol, Ticks.quantize(price).toPlainString(), orderId);
        return OrderRecord.placed(orderId, symbol.trim().toUpperCase(Locale.ROOT), side, amount, price,
                initialStatus, clock.instant());
    }

    @Override
    public OrderStatus orderStatus(String orderId) {
        return state.status(orderId).orElse(OrderStatus.UNKNOWN);
    }

    @Override
    public OrderStatus cancelOrder(String orderId) {
        if (!state.contains(orderId)) {
            return OrderStatus.UNKNOWN;
        }
        state.put(orderId, OrderStatus.CANCELED);
        return OrderStatus.CANCELED;
    }

    /** Marks a simulated order as filled. */
    public void fill(String orderId) {
        setStatus(orderId, OrderStatus.FILLED);
    }

    public void setStatus(String orderId, OrderStatus status) {
        if (!state.contains(orderId)) {
            throw new IllegalArgumentException("Unknown paper order: " + orderId);
        }
        state.put(orderId, Objects.requireNonNull(status, "status"));
    }

    private static BigDecimal decimal(ConfigPort config, ConfigKey key) {
        return config.getDecimal(key.key(), new BigDecimal(key.defaultValue()));
    }
}
