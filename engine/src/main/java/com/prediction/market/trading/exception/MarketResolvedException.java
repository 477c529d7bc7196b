package com.prediction.market.trading.exception;

/**
 * The market is resolved (or its question closed) and accepts no more trades.
 */
public class MarketResolvedException extends TradeException {

    public MarketResolvedException(String marketId, Object status) {
        super("MARKET_RESOLVED", "Market " + marketId + " is closed for trading: " + status,
            context("marketId", marketId, "status", status));
    }
}
