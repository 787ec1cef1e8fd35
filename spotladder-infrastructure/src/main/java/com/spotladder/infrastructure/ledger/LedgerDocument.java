package com.spotladder.infrastructure.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LedgerDocument(@JsonProperty("orders") List<LedgerEntry> orders) {
}
