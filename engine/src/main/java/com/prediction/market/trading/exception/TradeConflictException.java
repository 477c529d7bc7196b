package com.prediction.market.trading.exception;

/**
 * Commit retries were exhausted; the client should resubmit.
 */
public class TradeConflictException extends TradeException {

    public TradeConflictException(String tradeId, String marketId, int attempts, Throwable cause) {
        super("TRADE_CONFLICT",
            String.format("Trade %s on %s kept conflicting after %d attempts, please retry", tradeId, marketId, attempts),
            context("tradeId", tradeId, "marketId", marketId, "attempts", attempts), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
