package com.prediction.market.trading.exception;

public class MarketNotFoundException extends TradeException {

    public MarketNotFoundException(String marketId) {
        super("MARKET_NOT_FOUND", "Market or question not found: " + marketId, context("marketId", marketId));
    }
}
