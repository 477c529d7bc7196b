package com.prediction.market.trading.exception;

import java.math.BigDecimal;

/**
 * Zero, negative, missing or over-precise trade amount / share count.
 */
public class InvalidTradeSizeException extends TradeException {

    public InvalidTradeSizeException(String field, BigDecimal value) {
        super("INVALID_TRADE_SIZE",
            String.format("%s must be positive, got %s", field, value == null ? "null" : value.toPlainString()),
            context("field", field, "value", value));
    }

    public InvalidTradeSizeException(String field, BigDecimal value, String reason) {
        super("INVALID_TRADE_SIZE",
            String.format("%s %s, got %s", field, reason, value == null ? "null" : value.toPlainString()),
            context("field", field, "value", value));
    }
}
