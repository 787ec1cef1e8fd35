package com.spotladder.application.service;

import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderStatus;

import java.util.List;

/**
 * What one reconciliation run changed.
 *
 * @param statusChanges records whose status moved, in ledger order
 * @param linkedSells   sells created for newly filled buys
 * @param saved         whether the ledger was written
 */
public record ReconciliationReport(List<StatusChange> statusChanges, List<OrderRecord> linkedSells, boolean saved) {

    public ReconciliationReport {
        statusChanges = List.copyOf(statusChanges);
        linkedSells = List.copyOf(linkedSells);
    }

    public static ReconciliationReport empty() {
        return new ReconciliationReport(List.of(), List.of(), false);
    }

    public boolean changed() {
        return !statusChanges.isEmpty() || !linkedSells.isEmpty();
    }

    public record StatusChange(String orderId, OrderStatus from, OrderStatus to) {}
}
