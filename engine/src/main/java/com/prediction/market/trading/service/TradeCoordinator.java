package com.prediction.market.trading.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import com.prediction.market.trading.dto.BuyReceipt;
import com.prediction.market.trading.dto.MarketStateView;
import com.prediction.market.trading.dto.SellReceipt;
import com.prediction.market.trading.engine.BuyQuote;
import com.prediction.market.trading.engine.FeeCalculator;
import com.prediction.market.trading.engine.FeeSplit;
import com.prediction.market.trading.engine.FeeType;
import com.prediction.market.trading.engine.MarketPool;
import com.prediction.market.trading.engine.PricingCurve;
import com.prediction.market.trading.engine.SellQuote;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.TradeDirection;
import com.prediction.market.trading.entity.TradeExecution;
import com.prediction.market.trading.entity.TradeStatus;
import com.prediction.market.trading.entity.TransactionType;
import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.exception.MarketNotFoundException;
import com.prediction.market.trading.exception.TradeConflictException;
import com.prediction.market.trading.exception.TradeException;
import com.prediction.market.trading.execution.MarketExecutionRegistry;
import com.prediction.market.trading.ledger.MarketLedger;
import com.prediction.market.trading.ledger.PositionBook;
import com.prediction.market.trading.ledger.PositionDebit;
import com.prediction.market.trading.ledger.WalletLedger;
import com.prediction.market.trading.repositories.TradeTransaction;
import com.prediction.market.trading.repositories.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Executes buys and sells end to end.
 *
 * Trade Flow:
 * 1. Submit to the market's executor (one trade per market at a time)
 * 2. VALIDATING: size, market, wallet and holding checks (read-only)
 * 3. PRICING: quote against the current pool
 * 4. FEE_SPLIT: protocol fee and referrer share; buys are re-quoted on the net amount
 * 5. COMMITTING: wallet, market and position writes in one unit of work
 * 6. SETTLED, or back to PRICING if another writer moved a row first
 *
 * Failures before COMMITTING write nothing; failures during it roll back everything.
 */
@Slf4j
public class TradeCoordinator {

    private final MarketExecutionRegistry executionRegistry;
    private final UnitOfWork unitOfWork;
    private final MarketLedger marketLedger;
    private final PositionBook positionBook;
    private final WalletLedger walletLedger;
    private final PricingCurve pricingCurve;
    private final FeeCalculator feeCalculator;
    private final TradeValidator tradeValidator;
    private final Clock clock;
    private final int maxCommitAttempts;
    private final Duration retryBackoff;

    public TradeCoordinator(MarketExecutionRegistry executionRegistry, UnitOfWork unitOfWork,
                            MarketLedger marketLedger, PositionBook positionBook, WalletLedger walletLedger,
                            PricingCurve pricingCurve, FeeCalculator feeCalculator, TradeValidator tradeValidator,
                            Clock clock, int maxCommitAttempts, Duration retryBackoff) {
        if (maxCommitAttempts < 1) {
            throw new IllegalArgumentException("maxCommitAttempts must be at least 1: " + maxCommitAttempts);
        }
        this.executionRegistry = executionRegistry;
        this.unitOfWork = unitOfWork;
        this.marketLedger = marketLedger;
        this.positionBook = positionBook;
        this.walletLedger = walletLedger;
        this.pricingCurve = pricingCurve;
        this.feeCalculator = feeCalculator;
        this.tradeValidator = tradeValidator;
        this.clock = clock;
        this.maxCommitAttempts = maxCommitAttempts;
        this.retryBackoff = retryBackoff;
    }

    /**
     * Buy {@code side} shares for {@code grossAmount} cash, fee included.
     */
    public BuyReceipt buy(String userId, String marketId, Outcome side, BigDecimal grossAmount) {
        TradeExecution trade = new TradeExecution(userId, marketId, TradeDirection.BUY, side, grossAmount, clock);
        requireKnownMarket(trade);
        return executionRegistry.execute(marketId,
            () -> run(trade, () -> tradeValidator.validateBuy(trade), () -> attemptBuy(trade)));
    }

    /**
     * Sell from the user's only open position in the market, whichever side it is.
     */
    public SellReceipt sell(String userId, String marketId, BigDecimal shares) {
        return sell(userId, marketId, null, shares);
    }

    public SellReceipt sell(String userId, String marketId, Outcome side, BigDecimal shares) {
        TradeExecution trade = new TradeExecution(userId, marketId, TradeDirection.SELL, side, shares, clock);
        requireKnownMarket(trade);
        return executionRegistry.execute(marketId,
            () -> run(trade, () -> tradeValidator.validateSell(trade), () -> attemptSell(trade)));
    }

    public MarketStateView getMarketState(String marketId) {
        Market market = marketLedger.snapshot(marketId);
        BigDecimal yesPrice = PricingCurve.yesPrice(market.getYesPool(), market.getNoPool());
        return MarketStateView.builder()
            .marketId(market.getId())
            .question(market.getQuestion())
            .yesPrice(yesPrice)
            .noPrice(BigDecimal.ONE.subtract(yesPrice))
            .yesPool(market.getYesPool())
            .noPool(market.getNoPool())
            .liquidity(market.getLiquidity())
            .resolved(market.isResolved())
            .resolution(market.getResolution())
            .endDate(market.getEndDate())
            .build();
    }

    /**
     * Checked on the caller's thread: a market executor is only started for a market that exists.
     */
    private void requireKnownMarket(TradeExecution trade) {
        String marketId = trade.getMarketId();
        RuntimeException failure = null;
        if (marketId == null || marketId.trim().isEmpty()) {
            failure = new IllegalArgumentException("Trade validation failed: marketId is required");
        } else if (!marketLedger.exists(marketId)) {
            failure = new MarketNotFoundException(marketId);
        }
        if (failure != null) {
            reject(trade, failure.getMessage());
            log.warn("Trade rejected: tradeId={}, userId={}, market={}, direction={}, reason={}",
                trade.getTradeId(), trade.getUserId(), marketId, trade.getDirection(), failure.getMessage());
            throw failure;
        }
    }

    /**
     * Drive one trade through the state machine on the market's thread.
     */
    private <R> R run(TradeExecution trade, Runnable validation, Supplier<R> attempt) {
        try {
            validation.run();
            trade.transitionTo(TradeStatus.PRICING);

            while (true) {
                try {
                    R receipt = attempt.get();
                    trade.transitionTo(TradeStatus.SETTLED);
                    return receipt;
                } catch (ConcurrencyConflictException e) {
                    if (trade.getAttempts() >= maxCommitAttempts) {
                        throw new TradeConflictException(trade.getTradeId(), trade.getMarketId(), trade.getAttempts(), e);
                    }
                    log.warn("Commit conflict, retrying: tradeId={}, market={}, attempt={}, reason={}",
                        trade.getTradeId(), trade.getMarketId(), trade.getAttempts(), e.getMessage());
                    backoff(trade);
                    trade.transitionTo(TradeStatus.PRICING);
                }
            }
        } catch (TradeException | IllegalArgumentException e) {
            reject(trade, e.getMessage());
            log.warn("Trade rejected: tradeId={}, userId={}, market={}, direction={}, reason={}",
                trade.getTradeId(), trade.getUserId(), trade.getMarketId(), trade.getDirection(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            reject(trade, "Execution failed: " + e.getMessage());
            log.error("Trade failed: tradeId={}, market={}, status={}, error={}",
                trade.getTradeId(), trade.getMarketId(), trade.getStatus(), e.getMessage(), e);
            throw new IllegalStateException("Trade " + trade.getTradeId() + " failed", e);
        }
    }

    private BuyReceipt attemptBuy(TradeExecution trade) {
        String userId = trade.getUserId();
        String marketId = trade.getMarketId();
        Outcome side = trade.getSide();
        Money gross = Money.of(trade.getRequestedSize());

        // the gross quote enforces the price bound before any fee is taken
        MarketPool pool = marketLedger.tradablePool(marketId);
        pricingCurve.quoteBuy(pool, side, gross.toBigDecimal());
        trade.transitionTo(TradeStatus.FEE_SPLIT);

        Optional<String> referrer = walletLedger.referrerOf(userId);
        FeeSplit fees = feeCalculator.computeFee(gross, FeeType.PRED_BUY, referrer.isPresent());
        BuyQuote quote = pricingCurve.quoteBuy(pool, side, fees.getNetAmount().toBigDecimal());
        trade.transitionTo(TradeStatus.COMMITTING);

        try (TradeTransaction tx = unitOfWork.begin()) {
            walletLedger.debit(userId, gross, TransactionType.PRED_BUY, trade.getTradeId(), marketId,
                String.format("Bought %s %s shares", quote.getSharesBought().toPlainString(), side));
            marketLedger.applyBuy(marketId, quote, fees.getNetAmount());
            Position position = positionBook.credit(userId, marketId, side, quote.getSharesBought(), quote.getAvgPrice());
            payFees(trade, fees, referrer);
            BigDecimal newBalance = walletLedger.account(userId).getBalance();
            tx.commit();

            log.info("Trade settled: tradeId={}, userId={}, market={}, side={}, direction=BUY, gross={}, shares={}, avgPrice={}, fee={}",
                trade.getTradeId(), userId, marketId, side, gross, quote.getSharesBought(), quote.getAvgPrice(),
                fees.getFeeCharged());

            return BuyReceipt.builder()
                .tradeId(trade.getTradeId())
                .marketId(marketId)
                .side(side)
                .shares(quote.getSharesBought())
                .avgPrice(quote.getAvgPrice())
                .newYesPrice(quote.newYesPrice())
                .newNoPrice(quote.newNoPrice())
                .priceImpact(quote.getPriceImpact())
                .feeCharged(fees.getFeeCharged().toBigDecimal())
                .referrerPaid(fees.getReferrerShare().toBigDecimal())
                .newBalance(newBalance)
                .positionShares(position.getShares())
                .build();
        }
    }

    private SellReceipt attemptSell(TradeExecution trade) {
        String userId = trade.getUserId();
        String marketId = trade.getMarketId();
        Outcome side = trade.getSide();
        BigDecimal shares = trade.getRequestedSize();

        MarketPool pool = marketLedger.tradablePool(marketId);
        SellQuote quote = pricingCurve.quoteSell(pool, side, shares);
        trade.transitionTo(TradeStatus.FEE_SPLIT);

        Optional<String> referrer = walletLedger.referrerOf(userId);
        Money gross = Money.of(quote.getGrossProceeds());
        FeeSplit fees = feeCalculator.computeFee(gross, FeeType.PRED_SELL, referrer.isPresent());
        Money net = fees.getNetAmount();
        BigDecimal fillPrice = net.toBigDecimal().divide(shares, Money.SCALE, Money.ROUNDING_MODE);
        trade.transitionTo(TradeStatus.COMMITTING);

        try (TradeTransaction tx = unitOfWork.begin()) {
            PositionDebit debit = positionBook.debit(userId, marketId, side, shares, fillPrice);
            marketLedger.applySell(marketId, quote);
            if (net.isPositive()) {
                walletLedger.credit(userId, net, TransactionType.PRED_SELL, trade.getTradeId(), marketId,
                    String.format("Sold %s %s shares", shares.toPlainString(), side));
            }
            walletLedger.recordPnL(userId, Money.of(debit.getRealizedPnl()));
            payFees(trade, fees, referrer);
            BigDecimal newBalance = walletLedger.account(userId).getBalance();
            tx.commit();

            log.info("Trade settled: tradeId={}, userId={}, market={}, side={}, direction=SELL, shares={}, net={}, fee={}, pnl={}",
                trade.getTradeId(), userId, marketId, side, shares, net, fees.getFeeCharged(), debit.getRealizedPnl());

            return SellReceipt.builder()
                .tradeId(trade.getTradeId())
                .marketId(marketId)
                .side(side)
                .sharesSold(shares)
                .grossProceeds(gross.toBigDecimal())
                .netProceeds(net.toBigDecimal())
                .feeCharged(fees.getFeeCharged().toBigDecimal())
                .referrerPaid(fees.getReferrerShare().toBigDecimal())
                .pnl(debit.getRealizedPnl())
                .newYesPrice(quote.newYesPrice())
                .newNoPrice(quote.newNoPrice())
                .priceImpact(quote.getPriceImpact())
                .newBalance(newBalance)
                .positionClosed(debit.isClosed())
                .remainingShares(debit.getRemainingShares())
                .build();
        }
    }

    private void payFees(TradeExecution trade, FeeSplit fees, Optional<String> referrer) {
        if (fees.getFeeCharged().isPositive()) {
            walletLedger.recordFeePaid(trade.getUserId(), fees.getFeeCharged());
        }
        if (fees.hasReferrerShare() && referrer.isPresent()) {
            walletLedger.credit(referrer.get(), fees.getReferrerShare(), TransactionType.REFERRAL_FEE_EARNED,
                trade.getTradeId(), trade.getMarketId(), "Referral fee from " + trade.getUserId());
        }
    }

    private void backoff(TradeExecution trade) {
        long millis = retryBackoff.toMillis() * trade.getAttempts();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying trade " + trade.getTradeId(), e);
        }
    }

    private static void reject(TradeExecution trade, String reason) {
        if (!trade.getStatus().isTerminal()) {
            trade.reject(reason);
        }
    }
}
