package com.prediction.market.trading.exception;

import com.prediction.market.trading.entity.Outcome;

public class PositionNotFoundException extends TradeException {

    public PositionNotFoundException(String userId, String marketId, Outcome side) {
        super("POSITION_NOT_FOUND",
            String.format("No open %sposition for %s in %s", side == null ? "" : side + " ", userId, marketId),
            context("userId", userId, "marketId", marketId, "side", side));
    }
}
