package com.prediction.market.trading.exception;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

/**
 * A sell asks for more shares than the position holds.
 */
public class InsufficientSharesException extends TradeException {

    private final BigDecimal requested;
    private final BigDecimal held;

    public InsufficientSharesException(String userId, String marketId, Outcome side, BigDecimal requested, BigDecimal held) {
        super("INSUFFICIENT_SHARES",
            String.format("Cannot sell %s %s shares in %s: only %s held",
                requested.toPlainString(), side, marketId, held.toPlainString()),
            context("userId", userId, "marketId", marketId, "side", side, "requested", requested, "held", held));
        this.requested = requested;
        this.held = held;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getHeld() {
        return held;
    }
}
