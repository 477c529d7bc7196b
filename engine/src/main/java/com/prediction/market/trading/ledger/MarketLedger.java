package com.prediction.market.trading.ledger;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.prediction.market.trading.engine.BuyQuote;
import com.prediction.market.trading.engine.MarketPool;
import com.prediction.market.trading.engine.SellQuote;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Question;
import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.exception.MarketExpiredException;
import com.prediction.market.trading.exception.MarketNotFoundException;
import com.prediction.market.trading.exception.MarketResolvedException;
import com.prediction.market.trading.repositories.MarketRepository;
import com.prediction.market.trading.repositories.QuestionRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns market pools. The only component that writes yesPool, noPool, liquidity
 * or the resolution fields.
 *
 * A market that has never been traded is materialized from its question on
 * first use: the seed liquidity is split evenly between the two sides. Until
 * the first trade commits, the seeded market exists only in memory.
 */
@Slf4j
public class MarketLedger {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final MarketRepository marketRepository;
    private final QuestionRepository questionRepository;
    private final Clock clock;
    private final BigDecimal seedLiquidity;
    private final BigDecimal liquidityParameter;

    public MarketLedger(MarketRepository marketRepository, QuestionRepository questionRepository, Clock clock,
                        BigDecimal seedLiquidity, BigDecimal liquidityParameter) {
        if (seedLiquidity.signum() <= 0 || liquidityParameter.signum() <= 0) {
            throw new IllegalArgumentException("Seed liquidity and liquidity parameter must be positive");
        }
        this.marketRepository = marketRepository;
        this.questionRepository = questionRepository;
        this.clock = clock;
        this.seedLiquidity = seedLiquidity;
        this.liquidityParameter = liquidityParameter;
    }

    /**
     * Market that may be traded now, materialized from its question if needed.
     *
     * @throws MarketNotFoundException if neither a market nor a question exists
     * @throws MarketResolvedException if the market or its question is closed
     * @throws MarketExpiredException if the end date has passed
     */
    public Market tradableMarket(String marketId) {
        Optional<Market> stored = marketRepository.findById(marketId);
        Market market;
        if (stored.isPresent()) {
            market = stored.get();
        } else {
            Question question = findQuestion(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
            if (!question.isActive()) {
                throw new MarketResolvedException(marketId, question.getStatus());
            }
            market = seed(marketId, question.getText(), question.getResolutionDate(), seedLiquidity, liquidityParameter);
        }

        if (market.isResolved()) {
            throw new MarketResolvedException(marketId, "RESOLVED");
        }
        if (market.isExpiredAt(clock.instant())) {
            throw new MarketExpiredException(marketId, market.getEndDate());
        }
        return market;
    }

    public MarketPool tradablePool(String marketId) {
        return tradableMarket(marketId).toPool();
    }

    /**
     * Current state for display. Never writes; an untraded market of a known
     * question is returned as its seed preview.
     */
    public Market snapshot(String marketId) {
        return marketRepository.findById(marketId).orElseGet(() -> {
            Question question = findQuestion(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
            Market preview = seed(marketId, question.getText(), question.getResolutionDate(),
                seedLiquidity, liquidityParameter);
            preview.setResolved(!question.isActive());
            return preview;
        });
    }

    /**
     * Whether {@code marketId} names a stored market or a question one can be opened from.
     */
    public boolean exists(String marketId) {
        return marketRepository.findById(marketId).isPresent() || findQuestion(marketId).isPresent();
    }

    public Optional<Market> find(String marketId) {
        return marketRepository.findById(marketId);
    }

    public List<Market> all() {
        return marketRepository.findAll();
    }

    /**
     * Write the pools of a buy quote. {@code netAmount} is the cash entering the pool.
     *
     * @throws ConcurrencyConflictException if the market moved since the quote was taken
     */
    public Market applyBuy(String marketId, BuyQuote quote, Money netAmount) {
        if (quote.getAmount().compareTo(netAmount.toBigDecimal()) != 0) {
            throw new IllegalArgumentException("Quote amount " + quote.getAmount() + " does not match net amount " + netAmount);
        }
        Market market = tradableMarket(marketId);
        requireSameVersion(market, quote.getBasePool());

        BigDecimal before = market.getLiquidity();
        apply(market, quote.getNewYesPool(), quote.getNewNoPool());
        assertConserved(market, before.add(netAmount.toBigDecimal()));

        Market saved = marketRepository.save(market);
        log.debug("Market pools updated: marketId={}, yesPool={}, noPool={}, liquidity={}",
            marketId, saved.getYesPool(), saved.getNoPool(), saved.getLiquidity());
        return saved;
    }

    /**
     * Write the pools of a sell quote; the gross proceeds leave the pool.
     */
    public Market applySell(String marketId, SellQuote quote) {
        Market market = tradableMarket(marketId);
        requireSameVersion(market, quote.getBasePool());

        BigDecimal before = market.getLiquidity();
        apply(market, quote.getNewYesPool(), quote.getNewNoPool());
        assertConserved(market, before.subtract(quote.getGrossProceeds()));

        Market saved = marketRepository.save(market);
        log.debug("Market pools updated: marketId={}, yesPool={}, noPool={}, liquidity={}",
            marketId, saved.getYesPool(), saved.getNoPool(), saved.getLiquidity());
        return saved;
    }

    /**
     * Open a market explicitly rather than waiting for its first trade.
     */
    public Market create(String marketId, String question, Instant endDate, BigDecimal seed, BigDecimal depth) {
        if (marketRepository.findById(marketId).isPresent()) {
            throw new IllegalArgumentException("Market already exists: " + marketId);
        }
        BigDecimal liquidity = seed != null ? seed : seedLiquidity;
        BigDecimal b = depth != null ? depth : liquidityParameter;
        if (liquidity.signum() <= 0 || b.signum() <= 0) {
            throw new IllegalArgumentException("Seed liquidity and liquidity parameter must be positive");
        }
        return marketRepository.save(seed(marketId, question, endDate, liquidity, b));
    }

    /**
     * Freeze a market with its outcome. Payout is handled elsewhere.
     */
    public Market resolve(String marketId, Outcome outcome) {
        Market market = marketRepository.findById(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
        if (market.isResolved()) {
            throw new MarketResolvedException(marketId, "RESOLVED");
        }
        market.setResolved(true);
        market.setResolution(outcome == Outcome.YES);
        market.setUpdatedAt(clock.instant());
        return marketRepository.save(market);
    }

    private Optional<Question> findQuestion(String marketId) {
        Optional<Question> byId = questionRepository.findById(marketId);
        if (byId.isPresent()) {
            return byId;
        }
        try {
            return questionRepository.findLatestByQuestionNumber(Integer.parseInt(marketId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Market seed(String marketId, String question, Instant endDate, BigDecimal liquidity, BigDecimal depth) {
        Instant now = clock.instant();
        BigDecimal yes = liquidity.divide(TWO, Money.SCALE, Money.ROUNDING_MODE);
        return Market.builder()
            .id(marketId)
            .question(question)
            .yesPool(yes)
            .noPool(liquidity.setScale(Money.SCALE, Money.ROUNDING_MODE).subtract(yes))
            .liquidity(liquidity.setScale(Money.SCALE, Money.ROUNDING_MODE))
            .liquidityB(depth)
            .resolved(false)
            .endDate(endDate)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    private void apply(Market market, BigDecimal yesPool, BigDecimal noPool) {
        market.setYesPool(yesPool);
        market.setNoPool(noPool);
        market.setLiquidity(yesPool.add(noPool));
        market.setUpdatedAt(clock.instant());
    }

    private static void requireSameVersion(Market market, MarketPool basePool) {
        if (!Objects.equals(market.getVersion(), basePool.getVersion())) {
            throw new ConcurrencyConflictException("Market", market.getId(), basePool.getVersion(), market.getVersion());
        }
    }

    private static void assertConserved(Market market, BigDecimal expectedLiquidity) {
        if (market.getLiquidity().compareTo(expectedLiquidity) != 0
                || market.getYesPool().signum() <= 0 || market.getNoPool().signum() <= 0) {
            throw new IllegalStateException(String.format(
                "Liquidity not conserved for market %s: expected %s, pools %s + %s",
                market.getId(), expectedLiquidity, market.getYesPool(), market.getNoPool()));
        }
    }
}
