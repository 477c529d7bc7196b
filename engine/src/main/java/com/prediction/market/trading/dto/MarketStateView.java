package com.prediction.market.trading.dto;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only market snapshot. {@code resolution} is null until the market resolves.
 */
@Value
@Builder
public class MarketStateView {
    String marketId;
    String question;
    BigDecimal yesPrice;
    BigDecimal noPrice;
    BigDecimal yesPool;
    BigDecimal noPool;
    BigDecimal liquidity;
    boolean resolved;
    Boolean resolution;
    Instant endDate;
}
