package com.spotladder.infrastructure.paper;

import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperExchangeAdapterTest {

    private PaperExchangeAdapter paper;

    @BeforeEach
    void setUp() {
        AtomicInteger seq = new AtomicInteger();
        paper = new PaperExchangeAdapter(new PaperBrokerState(),
                new BigDecimal("1000"), new BigDecimal("0.5"), new BigDecimal("0.51"),
                OrderStatus.NEW, () -> "o" + seq.incrementAndGet(),
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void quotesAreFixed() {
        assertThat(paper.id()).isEqualTo(ExchangeId.PAPER);
        assertThat(paper.availableBalance("USDT")).isEqualByComparingTo("1000");
        assertThat(paper.highestBid("LTCUSDT")).isEqualByComparingTo("0.5");
        assertThat(paper.lowestAsk("LTCUSDT")).isEqualByComparingTo("0.51");
    }

    @Test
    void ordersGetDryIdsAndStayNewUntilFilled() {
        OrderRecord order = paper.createLimitOrder("ltcusdt", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("0.49"));

        assertThat(order.orderId()).isEqualTo("dry-o1");
        assertThat(order.symbol()).isEqualTo("LTCUSDT");
        assertThat(paper.orderStatus("dry-o1")).isEqualTo(OrderStatus.NEW);

        paper.fill("dry-o1");
        assertThat(paper.orderStatus("dry-o1")).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    void unknownIdsReportUnknown() {
        assertThat(paper.orderStatus("nope")).isEqualTo(OrderStatus.UNKNOWN);
        assertThat(paper.cancelOrder("nope")).isEqualTo(OrderStatus.UNKNOWN);
        assertThatThrownBy(() -> paper.fill("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelMarksKnownOrdersCanceled() {
        OrderRecord order = paper.createLimitOrder("LTCUSDT", OrderSide.BUY, BigDecimal.ONE, BigDecimal.ONE);

        assertThat(paper.cancelOrder(order.orderId())).isEqualTo(OrderStatus.CANCELED);
        assertThat(paper.orderStatus(order.orderId())).isEqualTo(OrderStatus.CANCELED);
    }
}
