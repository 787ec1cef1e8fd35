package com.spotladder.application.service;

import com.spotladder.domain.order.OrderRecord;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one auto ladder run.
 */
public record LadderResult(BigDecimal bestBid,
                           BigDecimal required,
                           List<OrderRecord> placed,
                           ReconciliationReport reconciliation) {

    public LadderResult {
        placed = List.copyOf(placed);
    }
}
