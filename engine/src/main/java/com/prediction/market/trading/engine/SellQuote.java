package com.prediction.market.trading.engine;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

import lombok.Builder;
import lombok.Value;

/**
 * Result of pricing a sell: gross cash leaving the pool and the pool afterwards.
 */
@Value
@Builder
public class SellQuote {
    Outcome side;
    BigDecimal sharesSold;
    BigDecimal grossProceeds;
    BigDecimal priceBefore;
    BigDecimal priceAfter;
    BigDecimal priceImpact;
    BigDecimal newYesPool;
    BigDecimal newNoPool;
    MarketPool basePool;

    public boolean isEmpty() {
        return sharesSold.signum() == 0;
    }

    public BigDecimal newYesPrice() {
        return PricingCurve.yesPrice(newYesPool, newNoPool);
    }

    public BigDecimal newNoPrice() {
        return BigDecimal.ONE.subtract(newYesPrice());
    }
}
