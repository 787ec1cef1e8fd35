package com.spotladder.infrastructure.exchange;

import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.exchange.RejectionKind;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.spotladder.infrastructure.exchange.ScriptedTransport.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtaixExchangeAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00.750Z"), ZoneOffset.UTC);

    private final ScriptedTransport transport = new ScriptedTransport();
    private final AtaixExchangeAdapter adapter =
            new AtaixExchangeAdapter(transport, OrderPlacementNegotiator.defaults(), CLOCK);

    @Test
    void balancePrefersAvailableThenBalanceThenAmount() {
        transport.answer(c -> json("{'balance':'5','available':'3.5'}"));
        assertThat(adapter.availableBalance("usdt")).isEqualByComparingTo("3.5");
        assertThat(transport.calls().get(0).path()).isEqualTo("/user/balances/USDT");

        transport.answer(c -> json("{'amount':7,'balance':'6'}"));
        assertThat(adapter.availableBalance("USDT")).isEqualByComparingTo("6");
    }

    @Test
    void balanceWithoutKnownFieldFails() {
        transport.answer(c -> json("{'currency':'USDT'}"));

        assertThatThrownBy(() -> adapter.availableBalance("USDT")).isInstanceOf(GatewayException.class);
    }

    @Test
    void bestQuotesAcrossMatchingEntriesInAnySpelling() {
        transport.answer(c -> json("[" +
                "{'symbol':'LTC/USDT','bid':'0.48','ask':'0.52'}," +
                "{'symbolCode':'ltc-usdt','buy':'0.50','sell':'0.51'}," +
                "{'baseCurrency':'LTC','quoteCurrency':'USDT','highestBid':'0.49','lowestAsk':'0.515'}," +
                "{'symbol':'BTC/USDT','bid':'90000','ask':'90001'}]"));

        assertThat(adapter.highestBid("LTCUSDT")).isEqualByComparingTo("0.50");
        assertThat(adapter.lowestAsk("LTCUSDT")).isEqualByComparingTo("0.51");
    }

    @Test
    void missingQuoteIsAGatewayError() {
        transport.answer(c -> json("[{'symbol':'BTC/USDT','bid':'1'}]"));

        assertThatThrownBy(() -> adapter.highestBid("LTCUSDT"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("LTCUSDT");
    }

    @Test
    void priceFeedSpellingIsCachedForOrderPlacement() {
        transport.answer(c -> json("{'result':[{'symbol':'LTC_USDT','bid':'0.5'}]}"));
        adapter.highestBid("LTCUSDT");

        assertThat(adapter.symbols().lookup("ltc-usdt")).hasValueSatisfying(info -> {
            assertThat(info.base()).isEqualTo("LTC");
            assertThat(info.quote()).isEqualTo("USDT");
            assertThat(info.raw()).isEqualTo("LTC_USDT");
        });
    }

    @Test
    void explicitBaseAndQuoteWinOverSplitting() {
        transport.answer(c -> json("[{'symbol':'LTCUSD','baseCurrencyCode':'ltc','quoteCurrency':'usd','bid':'2'}]"));
        adapter.highestBid("LTCUSD");

        assertThat(adapter.symbols().resolve("LTCUSD").toString()).isEqualTo("LTC/USD");
    }

    @Test
    void createdOrderCarriesIdStatusAndSecondPrecisionTime() {
        transport.answer(c -> json("{'orderID':'A-1','status':'new'}"));

        OrderRecord record = adapter.createLimitOrder("ltcusdt", OrderSide.BUY, new BigDecimal("10"), new BigDecimal("0.4900000099"));

        assertThat(record.orderId()).isEqualTo("A-1");
        assertThat(record.symbol()).isEqualTo("LTCUSDT");
        assertThat(record.status()).isEqualTo(OrderStatus.NEW);
        assertThat(record.price().toPlainString()).isEqualTo("0.49000000");
        assertThat(record.createdAt()).isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
        assertThat(record.note()).isNull();
        assertThat(transport.calls().get(0).body().get("symbol").asText()).isEqualTo("LTC-USDT");
    }

    @Test
    void orderWithoutStatusDefaultsToNew() {
        transport.answer(c -> json("{'id':'9'}"));

        assertThat(adapter.createLimitOrder("LTCUSDT", OrderSide.SELL, BigDecimal.ONE, BigDecimal.ONE).status())
                .isEqualTo(OrderStatus.NEW);
    }

    @Test
    void orderResponseWithoutIdFails() {
        transport.answer(c -> json("{'status':'NEW'}"));

        assertThatThrownBy(() -> adapter.createLimitOrder("LTCUSDT", OrderSide.BUY, BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("order id");
    }

    @Test
    void statusFieldsAreReadInPreferenceOrder() {
        transport.answer(c -> json("{'state':'open','orderStatus':'filled'}"));
        assertThat(adapter.orderStatus("A-1")).isEqualTo(OrderStatus.FILLED);
        assertThat(transport.calls().get(0).path()).isEqualTo("/orders/A-1");

        transport.answer(c -> json("{'state':'expired'}"));
        assertThat(adapter.orderStatus("A-1")).isEqualTo(OrderStatus.CANCELED);

        transport.answer(c -> json("{'state':'weird'}"));
        assertThat(adapter.orderStatus("A-1")).isEqualTo(OrderStatus.UNKNOWN);
    }

    @Test
    void statusWithoutAnyFieldFails() {
        transport.answer(c -> json("{'id':'A-1'}"));

        assertThatThrownBy(() -> adapter.orderStatus("A-1")).isInstanceOf(GatewayException.class);
    }

    @Test
    void cancelDefaultsToCanceled() {
        transport.answer(c -> json("{}"));
        assertThat(adapter.cancelOrder("A-1")).isEqualTo(OrderStatus.CANCELED);
        assertThat(transport.calls().get(0).method()).isEqualTo("DELETE");

        transport.answer(c -> json("{'status':'FILLED'}"));
        assertThat(adapter.cancelOrder("A-1")).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    void acceptedCancelWithNullResultIsCanceled() {
        AtaixHttpClient http = new AtaixHttpClient("https://example.invalid", null, null, Duration.ofSeconds(1));
        transport.answer(c -> http.interpret(200, "{\"status\":true,\"result\":null}"));

        assertThat(adapter.cancelOrder("42")).isEqualTo(OrderStatus.CANCELED);

        transport.answer(c -> http.interpret(200, ""));
        assertThat(adapter.cancelOrder("42")).isEqualTo(OrderStatus.CANCELED);
    }

    @Test
    void rejectionsPropagateUnchanged() {
        transport.answer(c -> {
            throw new GatewayException(RejectionKind.OTHER, "Order not found");
        });

        assertThatThrownBy(() -> adapter.cancelOrder("zzz")).hasMessage("Order not found");
    }
}
