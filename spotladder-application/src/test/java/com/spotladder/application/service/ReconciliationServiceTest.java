package com.spotladder.application.service;

import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.ports.OrderLedgerPort;
import com.spotladder.application.support.FakeExchange;
import com.spotladder.application.support.InMemoryOrderLedger;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationServiceTest {

    private static final BigDecimal MARKUP = new BigDecimal("0.02");
    private static final Instant T0 = Instant.parse("2025-02-10T08:00:00Z");

    private FakeExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = new FakeExchange();
    }

    private static OrderRecord storedBuy(String id, String price, OrderStatus status) {
        return new OrderRecord(id, "LTCUSDT", OrderSide.BUY, new BigDecimal("10"), new BigDecimal(price),
                status, T0, "Buy order 2% below best bid", null);
    }

    @Test
    void emptyLedgerIsNeitherPolledNorSaved() {
        OrderLedgerPort ledger = mock(OrderLedgerPort.class);
        when(ledger.load()).thenReturn(List.of());

        ReconciliationReport report = new ReconciliationService(exchange, ledger, MARKUP).reconcile();

        assertThat(report.changed()).isFalse();
        assertThat(report.saved()).isFalse();
        assertThat(exchange.polled()).isEmpty();
        verify(ledger, never()).save(any());
    }

    @Test
    void filledBuyGetsExactlyOneLinkedSellAcrossRuns() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(storedBuy("buy-1", "0.49", OrderStatus.NEW));
        exchange.setStatus("buy-1", OrderStatus.NEW);
        ReconciliationService service = new ReconciliationService(exchange, ledger, MARKUP);

        ReconciliationReport first = service.reconcile();
        assertThat(first.changed()).isFalse();
        assertThat(ledger.saves()).isZero();

        exchange.setStatus("buy-1", OrderStatus.FILLED);
        ReconciliationReport second = service.reconcile();

        assertThat(second.statusChanges())
                .containsExactly(new ReconciliationReport.StatusChange("buy-1", OrderStatus.NEW, OrderStatus.FILLED));
        assertThat(second.linkedSells()).hasSize(1);

        List<OrderRecord> stored = ledger.stored();
        assertThat(stored).hasSize(2);
        OrderRecord buy = stored.get(0);
        OrderRecord sell = stored.get(1);
        assertThat(sell.side()).isEqualTo(OrderSide.SELL);
        assertThat(sell.price().toPlainString()).isEqualTo("0.49980000");
        assertThat(sell.amount()).isEqualTo(buy.amount());
        assertThat(sell.linkedOrderId()).isEqualTo("buy-1");
        assertThat(sell.note()).isEqualTo("Sell order +2% over buy buy-1");
        assertThat(buy.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(buy.linkedOrderId()).isEqualTo(sell.orderId());

        for (int run = 0; run < 5; run++) {
            service.reconcile();
        }
        assertThat(exchange.placed()).hasSize(1);
        assertThat(ledger.stored()).hasSize(2);
        assertThat(ledger.stored().get(0).linkedOrderId()).isEqualTo(sell.orderId());
    }

    @Test
    void terminalRecordsAreNotPolledAgain() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(
                storedBuy("buy-1", "0.49", OrderStatus.CANCELED),
                storedBuy("buy-2", "0.47", OrderStatus.NEW));
        exchange.setStatus("buy-2", OrderStatus.NEW);

        new ReconciliationService(exchange, ledger, MARKUP).reconcile();

        assertThat(exchange.polled()).containsExactly("buy-2");
    }

    @Test
    void unknownStatusIsPolledOnTheNextRun() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(storedBuy("buy-1", "0.49", OrderStatus.NEW));
        ReconciliationService service = new ReconciliationService(exchange, ledger, MARKUP);

        service.reconcile();
        assertThat(ledger.stored().get(0).status()).isEqualTo(OrderStatus.UNKNOWN);

        exchange.setStatus("buy-1", OrderStatus.FILLED);
        ReconciliationReport report = service.reconcile();

        assertThat(report.statusChanges())
                .containsExactly(new ReconciliationReport.StatusChange("buy-1", OrderStatus.UNKNOWN, OrderStatus.FILLED));
        assertThat(report.linkedSells()).hasSize(1);
    }

    @Test
    void failedSellPlacementKeepsStatusAndIsRetriedNextRun() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(storedBuy("buy-1", "0.49", OrderStatus.NEW));
        exchange.setStatus("buy-1", OrderStatus.FILLED);
        exchange.failPlacementsAfter(0);
        ReconciliationService service = new ReconciliationService(exchange, ledger, MARKUP);

        assertThatThrownBy(service::reconcile).isInstanceOf(GatewayException.class);

        OrderRecord afterFailure = ledger.stored().get(0);
        assertThat(afterFailure.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(afterFailure.isLinked()).isFalse();

        exchange.stopFailing();
        ReconciliationReport retry = service.reconcile();

        assertThat(retry.statusChanges()).isEmpty();
        assertThat(retry.linkedSells()).hasSize(1);
        assertThat(ledger.stored().get(0).linkedOrderId()).isEqualTo(retry.linkedSells().get(0).orderId());
    }

    @Test
    void sellsPlacedBeforeAFailureAreSaved() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(
                storedBuy("buy-1", "0.49", OrderStatus.NEW),
                storedBuy("buy-2", "0.475", OrderStatus.NEW));
        exchange.setStatus("buy-1", OrderStatus.FILLED);
        exchange.setStatus("buy-2", OrderStatus.FILLED);
        exchange.failPlacementsAfter(1);
        ReconciliationService service = new ReconciliationService(exchange, ledger, MARKUP);

        assertThatThrownBy(service::reconcile).isInstanceOf(GatewayException.class);

        List<OrderRecord> stored = ledger.stored();
        assertThat(stored).hasSize(3);
        assertThat(stored.get(0).linkedOrderId()).isEqualTo(stored.get(2).orderId());
        assertThat(stored.get(1).status()).isEqualTo(OrderStatus.FILLED);
        assertThat(stored.get(1).isLinked()).isFalse();

        exchange.stopFailing();
        service.reconcile();

        assertThat(exchange.placed()).hasSize(2);
        assertThat(ledger.stored()).hasSize(4);
        assertThat(ledger.stored().get(1).linkedOrderId()).isEqualTo(ledger.stored().get(3).orderId());
    }

    @Test
    void sellPriceIsQuantizedMarkup() {
        InMemoryOrderLedger ledger = new InMemoryOrderLedger(storedBuy("buy-1", "0.33333333", OrderStatus.FILLED));

        ReconciliationReport report = new ReconciliationService(exchange, ledger, MARKUP).reconcile();

        assertThat(report.linkedSells().get(0).price().toPlainString()).isEqualTo("0.33999999");
    }
}
