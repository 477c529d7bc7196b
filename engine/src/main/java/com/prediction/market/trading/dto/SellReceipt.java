package com.prediction.market.trading.dto;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SellReceipt {
    String tradeId;
    String marketId;
    Outcome side;
    BigDecimal sharesSold;
    BigDecimal grossProceeds;
    BigDecimal netProceeds;
    BigDecimal feeCharged;
    BigDecimal referrerPaid;
    BigDecimal pnl;
    BigDecimal newYesPrice;
    BigDecimal newNoPrice;
    BigDecimal priceImpact;
    BigDecimal newBalance;
    boolean positionClosed;
    BigDecimal remainingShares;
}
