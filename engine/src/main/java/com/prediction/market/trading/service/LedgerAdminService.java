package com.prediction.market.trading.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.TransactionType;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.exception.MarketNotFoundException;
import com.prediction.market.trading.exception.TradeConflictException;
import com.prediction.market.trading.execution.MarketExecutionRegistry;
import com.prediction.market.trading.ledger.MarketLedger;
import com.prediction.market.trading.ledger.PositionBook;
import com.prediction.market.trading.ledger.WalletLedger;
import com.prediction.market.trading.repositories.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Account and market administration around the trading path: opening wallets,
 * deposits, explicit market creation and resolution, and read access to
 * holdings and history.
 */
@Slf4j
public class LedgerAdminService {

    private final UnitOfWork unitOfWork;
    private final MarketExecutionRegistry executionRegistry;
    private final MarketLedger marketLedger;
    private final PositionBook positionBook;
    private final WalletLedger walletLedger;
    private final Money defaultStartingBalance;
    private final int maxCommitAttempts;

    public LedgerAdminService(UnitOfWork unitOfWork, MarketExecutionRegistry executionRegistry,
                              MarketLedger marketLedger, PositionBook positionBook, WalletLedger walletLedger,
                              Money defaultStartingBalance, int maxCommitAttempts) {
        this.unitOfWork = unitOfWork;
        this.executionRegistry = executionRegistry;
        this.marketLedger = marketLedger;
        this.positionBook = positionBook;
        this.walletLedger = walletLedger;
        this.defaultStartingBalance = defaultStartingBalance;
        this.maxCommitAttempts = maxCommitAttempts;
    }

    public WalletAccount openAccount(String userId, String referrerId) {
        return openAccount(userId, defaultStartingBalance, referrerId);
    }

    public WalletAccount openAccount(String userId, Money startingBalance, String referrerId) {
        WalletAccount account = unitOfWork.inTransaction(
            () -> walletLedger.openAccount(userId, startingBalance, referrerId));
        log.info("Account opened: userId={}, startingBalance={}, referrerId={}", userId, startingBalance, referrerId);
        return account;
    }

    /**
     * Wallet rows are shared across markets, so a deposit can race a trade; it is retried like one.
     */
    public BalanceTransaction deposit(String userId, Money amount) {
        BalanceTransaction transaction = withRetry("deposit:" + userId, () -> unitOfWork.inTransaction(
            () -> walletLedger.credit(userId, amount, TransactionType.DEPOSIT, null, null, "Deposit")));
        log.info("Deposit booked: userId={}, amount={}, balance={}", userId, amount, transaction.getBalanceAfter());
        return transaction;
    }

    public Market createMarket(String marketId, String question, Instant endDate) {
        return createMarket(marketId, question, endDate, null, null);
    }

    public Market createMarket(String marketId, String question, Instant endDate,
                               BigDecimal seedLiquidity, BigDecimal liquidityParameter) {
        if (marketId == null || marketId.trim().isEmpty()) {
            throw new IllegalArgumentException("marketId is required");
        }
        if ((seedLiquidity != null && seedLiquidity.signum() <= 0)
                || (liquidityParameter != null && liquidityParameter.signum() <= 0)) {
            throw new IllegalArgumentException("Seed liquidity and liquidity parameter must be positive");
        }
        Market market = executionRegistry.execute(marketId, () -> unitOfWork.inTransaction(
            () -> marketLedger.create(marketId, question, endDate, seedLiquidity, liquidityParameter)));
        log.info("Market created: marketId={}, liquidity={}, endDate={}", marketId, market.getLiquidity(), endDate);
        return market;
    }

    /**
     * Resolution runs on the market's executor so that it is ordered with in-flight trades.
     */
    public Market resolveMarket(String marketId, Outcome outcome) {
        if (marketLedger.find(marketId).isEmpty()) {
            throw new MarketNotFoundException(marketId);
        }
        Market market = executionRegistry.execute(marketId,
            () -> unitOfWork.inTransaction(() -> marketLedger.resolve(marketId, outcome)));
        log.info("Market resolved: marketId={}, outcome={}", marketId, outcome);
        return market;
    }

    public WalletAccount account(String userId) {
        return walletLedger.account(userId);
    }

    public List<Position> positions(String userId) {
        return positionBook.positionsOf(userId);
    }

    public List<BalanceTransaction> history(String userId) {
        return walletLedger.history(userId);
    }

    private <T> T withRetry(String operation, Supplier<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return work.get();
            } catch (ConcurrencyConflictException e) {
                if (attempt >= maxCommitAttempts) {
                    throw new TradeConflictException(operation, null, attempt, e);
                }
                log.warn("Admin write conflicted, retrying: operation={}, attempt={}", operation, attempt);
            }
        }
    }
}
