package com.spotladder.application.service;

import java.math.BigDecimal;

public record MarketSnapshot(String symbol, String currency, BigDecimal available, BigDecimal bestBid, BigDecimal bestAsk) {}
