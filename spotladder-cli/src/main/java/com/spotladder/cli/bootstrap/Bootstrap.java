package com.spotladder.cli.bootstrap;

import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.exchange.ExchangeId;
import com.spotladder.application.exchange.ExchangePort;
import com.spotladder.application.ports.ConfigPort;
import com.spotladder.application.ports.OrderLedgerPort;
import com.spotladder.application.service.ReconciliationService;
import com.spotladder.application.service.TradingPolicy;
import com.spotladder.application.service.TradingWorkflow;
import com.spotladder.infrastructure.exchange.AtaixExchangeAdapter;
import com.spotladder.infrastructure.exchange.AtaixHttpClient;
import com.spotladder.infrastructure.exchange.OrderPlacementNegotiator;
import com.spotladder.infrastructure.ledger.JsonOrderLedger;
import com.spotladder.infrastructure.paper.PaperExchangeAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * Wires config into the exchange gateway, the ledger and the services. One gateway instance is shared by
 * the workflow and reconciliation for the whole run.
 */
public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    private Bootstrap() {}

    public static ExchangeId exchangeId(ConfigPort config) {
        String raw = config.get(ConfigKey.EXCHANGE.key(), ConfigKey.EXCHANGE.defaultValue());
        try {
            return ExchangeId.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported exchange: " + raw, e);
        }
    }

    public static ExchangePort createExchange(ConfigPort config, Clock clock) {
        ExchangeId id = exchangeId(config);
        log.info("Using {} exchange gateway", id);
        return switch (id) {
            case PAPER -> PaperExchangeAdapter.fromConfig(config, clock);
            case ATAIX -> new AtaixExchangeAdapter(AtaixHttpClient.fromConfig(config),
                    OrderPlacementNegotiator.fromConfig(config), clock);
        };
    }

    public static OrderLedgerPort createLedger(ConfigPort config) {
        return new JsonOrderLedger(Path.of(config.get(ConfigKey.LEDGER_FILE.key(), ConfigKey.LEDGER_FILE.defaultValue())));
    }

    public static TradingWorkflow createWorkflow(ConfigPort config, ExchangePort exchange, OrderLedgerPort ledger) {
        TradingPolicy policy = TradingPolicy.fromConfig(config);
        ReconciliationService reconciliation = new ReconciliationService(exchange, ledger, policy.sellMarkup());
        String symbol = config.get(ConfigKey.TRADE_SYMBOL.key(), ConfigKey.TRADE_SYMBOL.defaultValue());
        return new TradingWorkflow(exchange, ledger, reconciliation, policy, symbol);
    }

    public static TradingWorkflow createWorkflow(ConfigPort config) {
        return createWorkflow(config, createExchange(config, Clock.systemUTC()), createLedger(config));
    }
}
