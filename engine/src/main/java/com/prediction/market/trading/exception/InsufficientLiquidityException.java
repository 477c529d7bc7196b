package com.prediction.market.trading.exception;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

/**
 * The trade would push a price outside the tradable band, or the pool is empty.
 */
public class InsufficientLiquidityException extends TradeException {

    public InsufficientLiquidityException(Outcome side, BigDecimal size, BigDecimal resultingPrice) {
        super("INSUFFICIENT_LIQUIDITY",
            String.format("Market has insufficient liquidity for %s %s (resulting price %s)",
                size.toPlainString(), side, resultingPrice == null ? "n/a" : resultingPrice.toPlainString()),
            context("side", side, "size", size, "resultingPrice", resultingPrice));
    }
}
