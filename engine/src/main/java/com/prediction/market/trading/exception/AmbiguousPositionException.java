package com.prediction.market.trading.exception;

/**
 * A side-less sell was requested while the user holds both YES and NO.
 */
public class AmbiguousPositionException extends TradeException {

    public AmbiguousPositionException(String userId, String marketId) {
        super("AMBIGUOUS_POSITION",
            String.format("%s holds both YES and NO in %s; the side to sell is required", userId, marketId),
            context("userId", userId, "marketId", marketId));
    }
}
