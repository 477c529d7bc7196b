package com.prediction.market.trading.entity;

public enum TradeDirection {
    BUY,
    SELL
}
