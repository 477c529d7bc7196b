package com.prediction.market.trading.dto;

import java.math.BigDecimal;

import com.prediction.market.trading.entity.Outcome;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BuyReceipt {
    String tradeId;
    String marketId;
    Outcome side;
    BigDecimal shares;
    BigDecimal avgPrice;
    BigDecimal newYesPrice;
    BigDecimal newNoPrice;
    BigDecimal priceImpact;
    BigDecimal feeCharged;
    BigDecimal referrerPaid;
    BigDecimal newBalance;
    BigDecimal positionShares;   // total held on this side after the buy
}
