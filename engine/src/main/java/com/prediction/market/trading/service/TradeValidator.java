package com.prediction.market.trading.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.TradeExecution;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.exception.AmbiguousPositionException;
import com.prediction.market.trading.exception.InsufficientFundsException;
import com.prediction.market.trading.exception.InsufficientSharesException;
import com.prediction.market.trading.exception.InvalidTradeSizeException;
import com.prediction.market.trading.exception.PositionNotFoundException;
import com.prediction.market.trading.ledger.MarketLedger;
import com.prediction.market.trading.ledger.PositionBook;
import com.prediction.market.trading.ledger.WalletLedger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only checks a trade must pass before it is priced.
 *
 * Checks run in a fixed order (request fields, size, market, wallet, holding)
 * and the first failure is thrown as its typed exception. The commit stage
 * re-checks balance and holding against fresh state.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeValidator {

    private final MarketLedger marketLedger;
    private final PositionBook positionBook;
    private final WalletLedger walletLedger;

    public void validateBuy(TradeExecution trade) {
        requireFields(trade, true);
        BigDecimal amount = requirePositive("amount", trade.getRequestedSize());
        marketLedger.tradableMarket(trade.getMarketId());

        WalletAccount account = walletLedger.account(trade.getUserId());
        Money gross = Money.of(amount);
        if (!account.hasSufficientBalance(gross)) {
            throw new InsufficientFundsException(trade.getUserId(), gross, Money.ofNullable(account.getBalance()));
        }
    }

    /**
     * Also settles the trade's side when the caller left it to the single open position.
     */
    public void validateSell(TradeExecution trade) {
        requireFields(trade, false);
        BigDecimal shares = requirePositive("shares", trade.getRequestedSize());
        marketLedger.tradableMarket(trade.getMarketId());
        walletLedger.account(trade.getUserId());

        String userId = trade.getUserId();
        String marketId = trade.getMarketId();
        if (trade.getSide() == null) {
            List<Position> open = positionBook.openPositions(userId, marketId);
            if (open.isEmpty()) {
                throw new PositionNotFoundException(userId, marketId, null);
            }
            if (open.size() > 1) {
                throw new AmbiguousPositionException(userId, marketId);
            }
            trade.resolveSide(open.get(0).getSide());
        }

        Position position = positionBook.position(userId, marketId, trade.getSide())
            .orElseThrow(() -> new PositionNotFoundException(userId, marketId, trade.getSide()));
        if (shares.compareTo(position.getShares()) > 0) {
            throw new InsufficientSharesException(userId, marketId, trade.getSide(), shares, position.getShares());
        }
    }

    private void requireFields(TradeExecution trade, boolean sideRequired) {
        List<String> errors = new ArrayList<>();
        if (trade.getUserId() == null || trade.getUserId().trim().isEmpty()) {
            errors.add("userId is required");
        }
        if (trade.getMarketId() == null || trade.getMarketId().trim().isEmpty()) {
            errors.add("marketId is required");
        }
        if (sideRequired && trade.getSide() == null) {
            errors.add("side is required");
        }
        if (!errors.isEmpty()) {
            log.warn("Trade request invalid: {} (tradeId={})", errors, trade.getTradeId());
            throw new IllegalArgumentException("Trade validation failed: " + String.join("; ", errors));
        }
    }

    private static BigDecimal requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidTradeSizeException(field, value);
        }
        if (value.stripTrailingZeros().scale() > Money.SCALE) {
            throw new InvalidTradeSizeException(field, value, "has more than " + Money.SCALE + " decimal places");
        }
        return value;
    }
}
