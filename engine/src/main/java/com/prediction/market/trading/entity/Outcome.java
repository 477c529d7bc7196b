package com.prediction.market.trading.entity;

/**
 * The two tradable sides of a binary market.
 */
public enum Outcome {
    YES,
    NO
}
