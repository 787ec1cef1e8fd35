package com.spotladder.application.exchange;

/**
 * Supported gateways. PAPER never touches the network.
 */
public enum ExchangeId {
    ATAIX,
    PAPER
}
