package com.prediction.market.trading.ledger;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of reducing a position.
 */
@Value
@Builder
public class PositionDebit {
    Outcome side;
    BigDecimal sharesSold;
    BigDecimal avgPrice;
    BigDecimal realizedPnl;
    BigDecimal remainingShares;
    boolean closed;
}
