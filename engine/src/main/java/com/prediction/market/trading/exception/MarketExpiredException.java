package com.prediction.market.trading.exception;

import java.time.Instant;

public class MarketExpiredException extends TradeException {

    public MarketExpiredException(String marketId, Instant endDate) {
        super("MARKET_EXPIRED", "Market " + marketId + " expired at " + endDate,
            context("marketId", marketId, "endDate", endDate));
    }
}
