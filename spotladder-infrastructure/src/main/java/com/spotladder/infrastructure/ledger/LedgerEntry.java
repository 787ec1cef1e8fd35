package com.spotladder.infrastructure.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * On-disk shape of one ledger record. Decimals are plain strings, timestamps second-precision UTC.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"order_id", "symbol", "side", "amount", "price", "status", "created_at", "note", "linked_order_id"})
public record LedgerEntry(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("side") String side,
        @JsonProperty("amount") String amount,
        @JsonProperty("price") String price,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("note") String note,
        @JsonProperty("linked_order_id") String linkedOrderId
) {
}
