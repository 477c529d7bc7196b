package com.prediction.market.trading.exception;

import com.prediction.market.trading.entity.Money;

/**
 * A wallet debit would take the balance below zero.
 */
public class InsufficientFundsException extends TradeException {

    private final Money requested;
    private final Money available;

    public InsufficientFundsException(String userId, Money requested, Money available) {
        super("INSUFFICIENT_FUNDS",
            String.format("Insufficient balance for %s: have %s, need %s", userId, available, requested),
            context("userId", userId, "requested", requested.toBigDecimal(), "available", available.toBigDecimal()));
        this.requested = requested;
        this.available = available;
    }

    public Money getRequested() {
        return requested;
    }

    public Money getAvailable() {
        return available;
    }
}
