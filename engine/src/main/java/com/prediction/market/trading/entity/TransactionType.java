package com.prediction.market.trading.entity;

/**
 * Reason recorded on every balance mutation.
 */
public enum TransactionType {
    PRED_BUY,
    PRED_SELL,
    REFERRAL_FEE_EARNED,
    DEPOSIT
}
