package com.prediction.market.trading.engine;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

import lombok.Builder;
import lombok.Value;

/**
 * Result of pricing a buy: how many shares the amount buys and where the pool ends up.
 */
@Value
@Builder
public class BuyQuote {
    Outcome side;
    BigDecimal amount;        // cash entering the pool
    BigDecimal sharesBought;
    BigDecimal avgPrice;      // amount / sharesBought
    BigDecimal priceBefore;   // traded side
    BigDecimal priceAfter;    // traded side
    BigDecimal priceImpact;   // percent, display only
    BigDecimal newYesPool;
    BigDecimal newNoPool;
    MarketPool basePool;

    public boolean isEmpty() {
        return sharesBought.signum() == 0;
    }

    public BigDecimal newYesPrice() {
        return PricingCurve.yesPrice(newYesPool, newNoPool);
    }

    public BigDecimal newNoPrice() {
        return BigDecimal.ONE.subtract(newYesPrice());
    }
}
