package com.prediction.market.trading.entity;

public enum QuestionStatus {
    ACTIVE,
    RESOLVED,
    CANCELLED
}
