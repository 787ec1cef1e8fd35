package com.spotladder.cli.menu;

import com.spotladder.application.service.CancelOutcome;
import com.spotladder.application.service.MarketSnapshot;
import com.spotladder.application.service.ReconciliationReport;
import com.spotladder.application.service.TradingWorkflow;
import com.spotladder.domain.DomainException;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.Ticks;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * Operator loop: market header, recent orders, one discounted buy per configured menu discount, cancel,
 * sync. Failures are printed and the loop goes on; end of input quits.
 */
public final class InteractiveMenu {

    static final int RECENT_ORDERS = 5;

    private final TradingWorkflow workflow;
    private final Scanner sc;
    private final PrintStream out;

    public InteractiveMenu(TradingWorkflow workflow, Scanner sc, PrintStream out) {
        this.workflow = workflow;
        this.sc = sc;
        this.out = out;
    }

    public int run() {
        List<BigDecimal> discounts = workflow.policy().menuDiscounts();
        String cancelOption = String.valueOf(discounts.size() + 1);
        String syncOption = String.valueOf(discounts.size() + 2);

        while (true) {
            printHeader();
            printMenu(discounts, cancelOption, syncOption);

            String choice = prompt("Select");
            if (choice == null || choice.equalsIgnoreCase("q") || choice.equalsIgnoreCase("exit")) {
                out.println("Bye!");
                return 0;
            }

            try {
                int buyIndex = buyIndex(choice, discounts.size());
                if (buyIndex >= 0) {
                    buy(discounts.get(buyIndex));
                } else if (choice.equals(cancelOption)) {
                    cancel();
                } else if (choice.equals(syncOption)) {
                    sync();
                } else {
                    out.println("Unknown option: " + choice);
                }
            } catch (DomainException | IllegalArgumentException e) {
                out.println("Error: " + e.getMessage());
            }
        }
    }

    private void buy(BigDecimal discount) {
        String raw = prompt("Amount (blank to cancel)");
        if (raw == null || raw.isEmpty()) {
            out.println("Cancelled.");
            return;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + raw, e);
        }
        OrderRecord placed = workflow.placeDiscountedBuy(discount, amount);
        out.println("Placed " + describe(placed));
    }

    private void cancel() {
        String id = prompt("Order id (blank to cancel)");
        if (id == null || id.isEmpty()) {
            out.println("Cancelled.");
            return;
        }
        CancelOutcome outcome = workflow.cancel(id);
        out.println("Order " + outcome.orderId() + " is " + outcome.remoteStatus()
                + (outcome.ledgerUpdated() ? " (ledger updated)" : ""));
    }

    private void sync() {
        ReconciliationReport report = workflow.sync();
        out.println("Status changes: " + report.statusChanges().size()
                + ", linked sells: " + report.linkedSells().size());
    }

    private void printHeader() {
        out.println();
        out.println("=== Spotladder " + workflow.symbol() + " ===");
        try {
            MarketSnapshot s = workflow.snapshot();
            out.println("Balance " + s.currency() + ": " + s.available().toPlainString());
            out.println("Best bid: " + s.bestBid().toPlainString() + "   Best ask: " + s.bestAsk().toPlainString());
        } catch (DomainException e) {
            out.println("Market data unavailable: " + e.getMessage());
        }

        List<OrderRecord> recent = workflow.recentOrders(RECENT_ORDERS);
        if (recent.isEmpty()) {
            out.println("No orders yet.");
        } else {
            out.println("Recent orders:");
            for (OrderRecord r : recent) out.println("  " + describe(r));
        }
        out.println();
    }

    private void printMenu(List<BigDecimal> discounts, String cancelOption, String syncOption) {
        for (int i = 0; i < discounts.size(); i++) {
            out.println((i + 1) + ") Buy " + Ticks.percent(discounts.get(i)) + "% below best bid");
        }
        out.println(cancelOption + ") Cancel order");
        out.println(syncOption + ") Sync now");
        out.println("q) Quit");
    }

    private String prompt(String label) {
        out.print(label + ": ");
        out.flush();
        if (!sc.hasNextLine()) return null;
        return sc.nextLine().trim();
    }

    private static int buyIndex(String choice, int count) {
        try {
            int n = Integer.parseInt(choice);
            return n >= 1 && n <= count ? n - 1 : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public static String describe(OrderRecord r) {
        return String.format(Locale.ROOT, "%s %s %s %s @ %s %s%s",
                r.orderId(), r.side().wireName(), r.symbol(), r.amount().toPlainString(), r.price().toPlainString(),
                r.status(), r.note() == null ? "" : "  " + r.note());
    }
}
