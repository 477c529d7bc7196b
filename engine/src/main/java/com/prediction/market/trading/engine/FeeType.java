package com.prediction.market.trading.engine;

/**
 * Kinds of trade that carry a protocol fee.
 */
public enum FeeType {
    PRED_BUY,
    PRED_SELL
}
