package com.spotladder.cli.menu;

import com.spotladder.application.service.ReconciliationService;
import com.spotladder.application.service.TradingPolicy;
import com.spotladder.application.service.TradingWorkflow;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import com.spotladder.infrastructure.ledger.JsonOrderLedger;
import com.spotladder.infrastructure.paper.PaperBrokerState;
import com.spotladder.infrastructure.paper.PaperExchangeAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InteractiveMenuTest {

    @TempDir
    Path dir;

    private PaperExchangeAdapter paper;
    private JsonOrderLedger ledger;
    private TradingWorkflow workflow;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        AtomicInteger seq = new AtomicInteger();
        paper = new PaperExchangeAdapter(new PaperBrokerState(),
                new BigDecimal("1000"), new BigDecimal("0.5"), new BigDecimal("0.51"),
                OrderStatus.NEW, () -> String.valueOf(seq.incrementAndGet()),
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        ledger = new JsonOrderLedger(dir.resolve("orders.json"));
        TradingPolicy policy = TradingPolicy.defaults();
        workflow = new TradingWorkflow(paper, ledger,
                new ReconciliationService(paper, ledger, policy.sellMarkup()), policy, "LTCUSDT");
        out = new ByteArrayOutputStream();
    }

    private int run(String input) {
        return new InteractiveMenu(workflow, new Scanner(input),
                new PrintStream(out, true, StandardCharsets.UTF_8)).run();
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void headerShowsMarketAndOptions() {
        assertThat(run("q\n")).isZero();

        assertThat(output())
                .contains("Balance USDT: 1000")
                .contains("Best bid: 0.5   Best ask: 0.51")
                .contains("3) Buy 6% below best bid")
                .contains("4) Cancel order")
                .contains("5) Sync now")
                .contains("No orders yet.");
    }

    @Test
    void blankAmountPlacesNothing() {
        run("2\n\nq\n");

        assertThat(ledger.load()).isEmpty();
        assertThat(output()).contains("Cancelled.");
    }

    @Test
    void badAmountIsReportedAndLoopContinues() {
        run("1\nabc\n1\n-3\n2\n1\nq\n");

        List<OrderRecord> stored = ledger.load();
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).price().toPlainString()).isEqualTo("0.48000000");
        assertThat(output()).contains("Error: Not a number: abc");
    }

    @Test
    void syncAfterFillPlacesLinkedSell() {
        run("1\n10\nq\n");
        paper.fill("dry-1");

        run("5\nq\n");

        List<OrderRecord> stored = ledger.load();
        assertThat(stored).hasSize(2);
        assertThat(stored.get(1).side()).isEqualTo(OrderSide.SELL);
        assertThat(stored.get(1).price().toPlainString()).isEqualTo("0.49980000");
        assertThat(stored.get(0).linkedOrderId()).isEqualTo("dry-2");
        assertThat(output()).contains("linked sells: 1");
    }

    @Test
    void cancelUpdatesTheLedger() {
        run("1\n10\n4\ndry-1\nq\n");

        assertThat(ledger.load().get(0).status()).isEqualTo(OrderStatus.CANCELED);
        assertThat(output()).contains("Order dry-1 is CANCELED (ledger updated)");
    }

    @Test
    void endOfInputQuits() {
        assertThat(run("")).isZero();
        assertThat(run("9\n")).isZero();
        assertThat(output()).contains("Unknown option: 9");
    }
}
