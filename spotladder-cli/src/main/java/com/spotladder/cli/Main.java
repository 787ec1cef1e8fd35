package com.spotladder.cli;

import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.config.ConfigValidationResult;
import com.spotladder.application.config.ConfigValidator;
import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.application.ports.ConfigPort;
import com.spotladder.application.service.CancelOutcome;
import com.spotladder.application.service.LadderResult;
import com.spotladder.application.service.ReconciliationReport;
import com.spotladder.application.service.TradingWorkflow;
import com.spotladder.cli.bootstrap.Bootstrap;
import com.spotladder.cli.menu.InteractiveMenu;
import com.spotladder.domain.DomainException;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.Ticks;
import com.spotladder.infrastructure.config.FileConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Scanner;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    /** Loads file/env configuration for a profile (null for the default one). */
    @FunctionalInterface
    interface ConfigLoader {
        ConfigPort load(String profile) throws IOException;
    }

    private final ConfigLoader loader;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    Main(ConfigLoader loader, InputStream in, PrintStream out, PrintStream err) {
        this.loader = loader;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Main(FileConfigService::defaultFromWorkingDir, System.in, System.out, System.err).run(args));
    }

    int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printHelp(err);
            return USAGE;
        }

        if (options.command().equals("help")) {
            printHelp(out);
            return OK;
        }

        ConfigPort config;
        try {
            config = withOverrides(loader.load(options.profile()), options);
        } catch (IOException e) {
            err.println("Failed to load config: " + e.getMessage());
            return FAILED;
        }

        if (options.command().equals("validate-config")) {
            return validateConfig(config);
        }
        if (!options.command().equals("orders")) {
            ConfigValidationResult validation = new ConfigValidator().validate(config);
            if (!validation.isValid()) {
                validation.errors().forEach(e -> err.println("Config error: " + e));
                return FAILED;
            }
        }

        try {
            TradingWorkflow workflow = Bootstrap.createWorkflow(config);
            switch (options.command()) {
                case "auto":
                    return auto(workflow, options);
                case "sync":
                    return sync(workflow);
                case "cancel":
                    return cancel(workflow, options);
                case "orders":
                    return orders(workflow);
                default:
                    return new InteractiveMenu(workflow, new Scanner(in), out).run();
            }
        } catch (DomainException | IllegalArgumentException e) {
            log.debug("Command '{}' failed", options.command(), e);
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    private static ConfigPort withOverrides(ConfigPort base, CliOptions options) {
        OverrideConfig oc = new OverrideConfig(base)
                .with(ConfigKey.TRADE_SYMBOL.key(), options.symbol())
                .with(ConfigKey.LEDGER_FILE.key(), options.orderFile());
        if (options.dryRun()) {
            oc.with(ConfigKey.EXCHANGE.key(), ExchangeId.PAPER.name());
        }
        return oc;
    }

    private int auto(TradingWorkflow workflow, CliOptions options) {
        if (options.amount() == null) {
            err.println("auto requires --amount");
            return USAGE;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(options.amount());
        } catch (NumberFormatException e) {
            err.println("Not a number: " + options.amount());
            return USAGE;
        }

        LadderResult result = workflow.runAuto(amount);
        out.println("Best bid: " + result.bestBid().toPlainString()
                + "   Required " + workflow.policy().quoteCurrency() + ": " + Ticks.quantize(result.required()).toPlainString());
        for (OrderRecord r : result.placed()) {
            out.println("Placed " + InteractiveMenu.describe(r));
        }
        printReport(result.reconciliation());
        return OK;
    }

    private int sync(TradingWorkflow workflow) {
        printReport(workflow.sync());
        return OK;
    }

    private int cancel(TradingWorkflow workflow, CliOptions options) {
        List<String> ids = options.positional();
        if (ids.size() != 1) {
            err.println("cancel requires exactly one order id");
            return USAGE;
        }
        CancelOutcome outcome = workflow.cancel(ids.get(0));
        out.println("Order " + outcome.orderId() + " is " + outcome.remoteStatus()
                + (outcome.ledgerUpdated() ? " (ledger updated)" : ""));
        return OK;
    }

    private int orders(TradingWorkflow workflow) {
        List<OrderRecord> all = workflow.allOrders();
        if (all.isEmpty()) {
            out.println("No orders yet.");
        }
        for (OrderRecord r : all) {
            out.println(InteractiveMenu.describe(r)
                    + (r.linkedOrderId() == null ? "" : "  linked=" + r.linkedOrderId()));
        }
        return OK;
    }

    private int validateConfig(ConfigPort config) {
        ConfigValidationResult result = new ConfigValidator().validate(config);
        if (result.isValid()) {
            out.println("Config OK");
            return OK;
        }
        result.errors().forEach(e -> out.println("- " + e));
        return FAILED;
    }

    private void printReport(ReconciliationReport report) {
        for (ReconciliationReport.StatusChange c : report.statusChanges()) {
            out.println("Order " + c.orderId() + ": " + c.from() + " -> " + c.to());
        }
        for (OrderRecord sell : report.linkedSells()) {
            out.println("Placed " + InteractiveMenu.describe(sell));
        }
        if (!report.changed()) {
            out.println("Ledger up to date.");
        }
    }

    private static void printHelp(PrintStream ps) {
        ps.println("Spotladder CLI");
        ps.println("Usage:");
        ps.println("  java -jar spotladder-cli.jar                      (interactive menu)");
        ps.println("  java -jar spotladder-cli.jar auto --amount 10     (buy ladder, alias --auto)");
        ps.println("  java -jar spotladder-cli.jar sync                 (reconcile the ledger)");
        ps.println("  java -jar spotladder-cli.jar cancel <orderId>");
        ps.println("  java -jar spotladder-cli.jar orders");
        ps.println("  java -jar spotladder-cli.jar validate-config");
        ps.println("Options: --symbol LTCUSDT  --order-file orders.json  --dry-run  --profile NAME");
    }
}
