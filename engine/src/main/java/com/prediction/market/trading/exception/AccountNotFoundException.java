package com.prediction.market.trading.exception;

public class AccountNotFoundException extends TradeException {

    public AccountNotFoundException(String userId) {
        super("ACCOUNT_NOT_FOUND", "Wallet account not found: " + userId, context("userId", userId));
    }
}
