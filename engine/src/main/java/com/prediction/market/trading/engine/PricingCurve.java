package com.prediction.market.trading.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.exception.InsufficientLiquidityException;
import com.prediction.market.trading.exception.InvalidTradeSizeException;

import lombok.extern.slf4j.Slf4j;

/**
 * Bonding curve for binary markets: a two-outcome quadratic scoring rule.
 *
 * The price of a side is its share of the pool, p = sidePool / (yesPool + noPool).
 * With depth b the price moves linearly in shares traded, so buying s shares
 * costs s*p + s^2/(4b). Solving for a cash amount a gives
 *
 *   p' = sqrt(p^2 + a/b),   s = 2b(p' - p),   avgPrice = a/s = (p + p') / 2
 *
 * and selling s shares pays s*(p + p')/2 with p' = p - s/(2b). The cost function
 * is path independent: selling the shares a buy produced returns exactly the
 * amount that bought them.
 *
 * After every trade the pool total moves by exactly the cash that entered or left,
 * and is re-split between the sides at the new price. Trades that would leave the
 * price band [{@link #MIN_PRICE}, {@link #MAX_PRICE}] are rejected.
 *
 * Stateless and thread-safe.
 */
@Slf4j
public class PricingCurve {

    public static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
    public static final BigDecimal MAX_PRICE = new BigDecimal("0.99");

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int IMPACT_SCALE = 4;

    /**
     * YES price of a pool, rounded to {@link Money#SCALE}.
     */
    public static BigDecimal yesPrice(BigDecimal yesPool, BigDecimal noPool) {
        BigDecimal total = yesPool.add(noPool);
        if (total.signum() <= 0) {
            throw new InsufficientLiquidityException(Outcome.YES, BigDecimal.ZERO, null);
        }
        return yesPool.divide(total, Money.SCALE, Money.ROUNDING_MODE);
    }

    public BigDecimal price(MarketPool pool, Outcome side) {
        BigDecimal yes = yesPrice(pool.getYesPool(), pool.getNoPool());
        return side == Outcome.YES ? yes : BigDecimal.ONE.subtract(yes);
    }

    /**
     * Price a buy of {@code amount} cash (the amount that enters the pool, i.e. after fees).
     */
    public BuyQuote quoteBuy(MarketPool pool, Outcome side, BigDecimal amount) {
        requireNonNegative("amount", amount);
        BigDecimal exact = exactPrice(pool, side);
        BigDecimal p = exact.setScale(Money.SCALE, Money.ROUNDING_MODE);

        if (amount.signum() == 0) {
            return BuyQuote.builder()
                .side(side)
                .amount(BigDecimal.ZERO)
                .sharesBought(BigDecimal.ZERO)
                .avgPrice(p)
                .priceBefore(p)
                .priceAfter(p)
                .priceImpact(BigDecimal.ZERO)
                .newYesPool(pool.getYesPool())
                .newNoPool(pool.getNoPool())
                .basePool(pool)
                .build();
        }

        BigDecimal b = depth(pool);
        BigDecimal exactAfter = exact.multiply(exact, MC).add(amount.divide(b, MC), MC).sqrt(MC);
        if (exactAfter.compareTo(MAX_PRICE) > 0) {
            throw new InsufficientLiquidityException(side, amount, exactAfter.setScale(Money.SCALE, RoundingMode.HALF_EVEN));
        }

        // shares round toward the pool
        BigDecimal shares = TWO.multiply(b, MC).multiply(exactAfter.subtract(exact, MC), MC)
            .setScale(Money.SCALE, RoundingMode.DOWN);
        if (shares.signum() <= 0) {
            throw new InvalidTradeSizeException("amount", amount);
        }

        BigDecimal newTotal = pool.total().add(amount);
        BigDecimal newSidePool = exactAfter.multiply(newTotal, MC).setScale(Money.SCALE, Money.ROUNDING_MODE);
        BigDecimal newOtherPool = newTotal.subtract(newSidePool);
        BigDecimal priceAfter = exactAfter.setScale(Money.SCALE, Money.ROUNDING_MODE);

        BuyQuote quote = BuyQuote.builder()
            .side(side)
            .amount(amount)
            .sharesBought(shares)
            .avgPrice(amount.divide(shares, Money.SCALE, Money.ROUNDING_MODE))
            .priceBefore(p)
            .priceAfter(priceAfter)
            .priceImpact(impact(p, priceAfter))
            .newYesPool(side == Outcome.YES ? newSidePool : newOtherPool)
            .newNoPool(side == Outcome.YES ? newOtherPool : newSidePool)
            .basePool(pool)
            .build();

        log.debug("Quoted buy: side={}, amount={}, shares={}, price {} -> {}",
            side, amount, shares, p, priceAfter);
        return quote;
    }

    /**
     * Price a sell of {@code shares}; the proceeds are gross, before any fee.
     */
    public SellQuote quoteSell(MarketPool pool, Outcome side, BigDecimal shares) {
        requireNonNegative("shares", shares);
        BigDecimal exact = exactPrice(pool, side);
        BigDecimal p = exact.setScale(Money.SCALE, Money.ROUNDING_MODE);

        if (shares.signum() == 0) {
            return SellQuote.builder()
                .side(side)
                .sharesSold(BigDecimal.ZERO)
                .grossProceeds(BigDecimal.ZERO)
                .priceBefore(p)
                .priceAfter(p)
                .priceImpact(BigDecimal.ZERO)
                .newYesPool(pool.getYesPool())
                .newNoPool(pool.getNoPool())
                .basePool(pool)
                .build();
        }

        BigDecimal b = depth(pool);
        BigDecimal exactAfter = exact.subtract(shares.divide(TWO.multiply(b, MC), MC), MC);
        if (exactAfter.compareTo(MIN_PRICE) < 0) {
            throw new InsufficientLiquidityException(side, shares, exactAfter.setScale(Money.SCALE, RoundingMode.HALF_EVEN));
        }

        // proceeds round toward the pool
        BigDecimal gross = shares.multiply(exact.add(exactAfter, MC), MC).divide(TWO, MC)
            .setScale(Money.SCALE, RoundingMode.DOWN);
        if (gross.signum() <= 0) {
            throw new InvalidTradeSizeException("shares", shares, "are too few to pay out any proceeds");
        }
        BigDecimal newTotal = pool.total().subtract(gross);
        BigDecimal newSidePool = exactAfter.multiply(newTotal, MC).setScale(Money.SCALE, Money.ROUNDING_MODE);
        BigDecimal newOtherPool = newTotal.subtract(newSidePool);
        if (newSidePool.signum() <= 0 || newOtherPool.signum() <= 0) {
            throw new InsufficientLiquidityException(side, shares, exactAfter.setScale(Money.SCALE, RoundingMode.HALF_EVEN));
        }
        BigDecimal priceAfter = exactAfter.setScale(Money.SCALE, Money.ROUNDING_MODE);

        SellQuote quote = SellQuote.builder()
            .side(side)
            .sharesSold(shares)
            .grossProceeds(gross)
            .priceBefore(p)
            .priceAfter(priceAfter)
            .priceImpact(impact(p, priceAfter))
            .newYesPool(side == Outcome.YES ? newSidePool : newOtherPool)
            .newNoPool(side == Outcome.YES ? newOtherPool : newSidePool)
            .basePool(pool)
            .build();

        log.debug("Quoted sell: side={}, shares={}, gross={}, price {} -> {}",
            side, shares, gross, p, priceAfter);
        return quote;
    }

    // Unrounded pool ratio. Quotes are computed from it; rounded prices are display only.
    private static BigDecimal exactPrice(MarketPool pool, Outcome side) {
        BigDecimal total = pool.total();
        if (total.signum() <= 0) {
            throw new InsufficientLiquidityException(side, BigDecimal.ZERO, null);
        }
        BigDecimal sidePool = side == Outcome.YES ? pool.getYesPool() : pool.getNoPool();
        return sidePool.divide(total, MC);
    }

    private BigDecimal depth(MarketPool pool) {
        BigDecimal b = pool.getLiquidityB();
        if (b == null || b.signum() <= 0) {
            throw new IllegalStateException("Market liquidity parameter must be positive: " + b);
        }
        return b;
    }

    // Magnitude of the traded side's move, in percent.
    private static BigDecimal impact(BigDecimal before, BigDecimal after) {
        return after.subtract(before).abs()
            .multiply(HUNDRED)
            .divide(before, IMPACT_SCALE, RoundingMode.HALF_EVEN);
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidTradeSizeException(field, value);
        }
    }
}
