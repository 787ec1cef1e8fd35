package com.spotladder.domain.order;

import com.spotladder.domain.DomainException;

import java.math.BigDecimal;

/**
 * Raised before any order is placed when the reference price is at or above the configured ceiling.
 */
public final class PriceConstraintException extends DomainException {

    private final BigDecimal price;
    private final BigDecimal maxPrice;

    public PriceConstraintException(String symbol, BigDecimal price, BigDecimal maxPrice) {
        super("The price of " + symbol + " (" + price.toPlainString() + ") is not below the "
                + maxPrice.toPlainString() + " ceiling");
        this.price = price;
        this.maxPrice = maxPrice;
    }

    public BigDecimal price() { return price; }
    public BigDecimal maxPrice() { return maxPrice; }
}
