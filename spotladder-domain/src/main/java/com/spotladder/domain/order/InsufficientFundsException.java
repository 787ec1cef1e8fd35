package com.spotladder.domain.order;

import com.spotladder.domain.DomainException;

import java.math.BigDecimal;

/**
 * Raised before any order is placed when the available balance cannot cover the whole ladder.
 */
public final class InsufficientFundsException extends DomainException {

    private final String currency;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(String currency, BigDecimal available, BigDecimal required) {
        super("Not enough " + currency + " balance (" + available.toPlainString() + ") to cover "
                + required.toPlainString() + " required");
        this.currency = currency;
        this.available = available;
        this.required = required;
    }

    public String currency() { return currency; }
    public BigDecimal available() { return available; }
    public BigDecimal required() { return required; }
}
