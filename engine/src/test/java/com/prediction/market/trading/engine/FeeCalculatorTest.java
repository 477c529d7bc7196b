package com.prediction.market.trading.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.exception.InvalidTradeSizeException;

class FeeCalculatorTest {

    private final FeeCalculator calculator = FeeCalculator.withDefaults();

    @Test
    void computeFee_hundredDollarBuy_takesTwoPercent() {
        FeeSplit split = calculator.computeFee(Money.of(100), FeeType.PRED_BUY, false);

        assertThat(split.getFeeCharged()).isEqualTo(Money.of("2.00"));
        assertThat(split.getNetAmount()).isEqualTo(Money.of("98"));
        assertThat(split.getReferrerShare()).isEqualTo(Money.ZERO);
        assertThat(split.getPlatformShare()).isEqualTo(Money.of("2"));
        assertThat(split.hasReferrerShare()).isFalse();
    }

    @Test
    void computeFee_withReferrer_splitsFeeInHalf() {
        FeeSplit split = calculator.computeFee(Money.of(100), FeeType.PRED_SELL, true);

        assertThat(split.getReferrerShare()).isEqualTo(Money.of("1.00"));
        assertThat(split.getPlatformShare()).isEqualTo(Money.of("1.00"));
    }

    @Test
    void computeFee_roundsFeeUpAndReferrerShareDown() {
        // raw fee 0.2002 -> 0.21, referrer 0.105 -> 0.10
        FeeSplit split = calculator.computeFee(Money.of("10.01"), FeeType.PRED_BUY, true);

        assertThat(split.getFeeCharged()).isEqualTo(Money.of("0.21"));
        assertThat(split.getNetAmount()).isEqualTo(Money.of("9.80"));
        assertThat(split.getReferrerShare()).isEqualTo(Money.of("0.10"));
        assertThat(split.getPlatformShare()).isEqualTo(Money.of("0.11"));
    }

    @Test
    void computeFee_belowMinimum_isWaived() {
        FeeSplit split = calculator.computeFee(Money.of("0.40"), FeeType.PRED_BUY, true);

        assertThat(split.getFeeCharged()).isEqualTo(Money.ZERO);
        assertThat(split.getNetAmount()).isEqualTo(Money.of("0.40"));
        assertThat(split.getReferrerShare()).isEqualTo(Money.ZERO);
    }

    @Test
    void computeFee_atMinimum_isCharged() {
        FeeSplit split = calculator.computeFee(Money.of("0.50"), FeeType.PRED_BUY, false);

        assertThat(split.getFeeCharged()).isEqualTo(Money.of("0.01"));
    }

    @Test
    void computeFee_negativeGross_isInvalid() {
        assertThatThrownBy(() -> calculator.computeFee(Money.of("-1"), FeeType.PRED_BUY, false))
            .isInstanceOf(InvalidTradeSizeException.class);
    }

    @Test
    void feeRate_fallsBackToDefaultForMissingTypes() {
        FeeCalculator custom = new FeeCalculator(Map.of(FeeType.PRED_SELL, new BigDecimal("0.05")),
            new BigDecimal("0.25"), new BigDecimal("0.01"), 2);

        assertThat(custom.feeRate(FeeType.PRED_SELL)).isEqualByComparingTo("0.05");
        assertThat(custom.feeRate(FeeType.PRED_BUY)).isEqualByComparingTo(FeeCalculator.DEFAULT_RATE);
        assertThat(custom.computeFee(Money.of(100), FeeType.PRED_SELL, true).getReferrerShare())
            .isEqualTo(Money.of("1.25"));
    }

    @Test
    void constructor_rejectsRatesOfOneOrMore() {
        assertThatThrownBy(() -> new FeeCalculator(Map.of(FeeType.PRED_BUY, BigDecimal.ONE),
            FeeCalculator.DEFAULT_REFERRER_SHARE, FeeCalculator.DEFAULT_MIN_FEE, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
