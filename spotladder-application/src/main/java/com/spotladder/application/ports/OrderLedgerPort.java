package com.spotladder.application.ports;

import com.spotladder.domain.order.OrderRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable, ordered history of the orders this workflow placed.
 *
 * <p>No partial updates: callers load the whole sequence, change it in memory and save it back.
 * One process per ledger at a time; saves are whole-file overwrites without locking.
 */
public interface OrderLedgerPort {

    /**
     * @return records in insertion order; empty when nothing was saved yet
     * @throws LedgerCorruptException when stored data exists but cannot be read
     */
    List<OrderRecord> load();

    /**
     * Replaces the stored sequence. Readers observe either the old or the new sequence, never a mix.
     *
     * @throws LedgerWriteException when the data could not be written
     */
    void save(List<OrderRecord> records);

    default void append(List<OrderRecord> records) {
        if (records == null || records.isEmpty()) return;
        List<OrderRecord> all = new ArrayList<>(load());
        all.addAll(records);
        save(all);
    }
}
