package com.prediction.market.trading.exception;

import java.time.Duration;

/**
 * The caller stopped waiting. The trade itself still commits or rolls back in full.
 */
public class TradeTimeoutException extends TradeException {

    public TradeTimeoutException(String marketId, Duration timeout) {
        super("TRADE_TIMEOUT",
            String.format("No settlement result for market %s within %d ms", marketId, timeout.toMillis()),
            context("marketId", marketId, "timeoutMs", timeout.toMillis()));
    }
}
