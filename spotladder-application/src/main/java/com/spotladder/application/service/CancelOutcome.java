package com.spotladder.application.service;

import com.spotladder.domain.order.OrderStatus;

/**
 * @param remoteStatus status reported by the exchange after the cancel request
 * @param ledgerUpdated whether a local record was found and changed
 */
public record CancelOutcome(String orderId, OrderStatus remoteStatus, boolean ledgerUpdated) {}
