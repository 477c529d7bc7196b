package com.prediction.market.trading.engine;

import java.math.BigDecimal;

import lombok.Value;

/**
 * Read-only view of a market's pool as seen by one quote.
 *
 * The version is that of the market row the pool was read from; a quote is only
 * valid against a market that still carries the same version.
 */
@Value
public class MarketPool {
    BigDecimal yesPool;
    BigDecimal noPool;
    BigDecimal liquidityB;
    Long version;

    public BigDecimal total() {
        return yesPool.add(noPool);
    }
}
