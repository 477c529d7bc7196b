package com.prediction.market.trading.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.exception.InvalidTradeSizeException;

import lombok.extern.slf4j.Slf4j;

/**
 * Protocol fee and referrer split.
 *
 * The fee rounds up to {@code feeScale} digits and the referrer's part rounds down,
 * so rounding never costs the platform. Fees whose unrounded value is below
 * {@code minFeeAmount} are waived.
 */
@Slf4j
public class FeeCalculator {

    public static final BigDecimal DEFAULT_RATE = new BigDecimal("0.02");
    public static final BigDecimal DEFAULT_REFERRER_SHARE = new BigDecimal("0.5");
    public static final BigDecimal DEFAULT_MIN_FEE = new BigDecimal("0.01");
    public static final int DEFAULT_FEE_SCALE = 2;

    private final Map<FeeType, BigDecimal> rates;
    private final BigDecimal referrerShare;
    private final BigDecimal minFeeAmount;
    private final int feeScale;

    public FeeCalculator(Map<FeeType, BigDecimal> rates, BigDecimal referrerShare,
                         BigDecimal minFeeAmount, int feeScale) {
        EnumMap<FeeType, BigDecimal> copy = new EnumMap<>(FeeType.class);
        for (FeeType type : FeeType.values()) {
            BigDecimal rate = rates.getOrDefault(type, DEFAULT_RATE);
            if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
                throw new IllegalArgumentException("Fee rate for " + type + " must be in [0, 1): " + rate);
            }
            copy.put(type, rate);
        }
        if (referrerShare.signum() < 0 || referrerShare.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Referrer share must be in [0, 1]: " + referrerShare);
        }
        if (feeScale < 0 || feeScale > Money.SCALE) {
            throw new IllegalArgumentException("Fee scale must be in [0, " + Money.SCALE + "]: " + feeScale);
        }
        this.rates = Collections.unmodifiableMap(copy);
        this.referrerShare = referrerShare;
        this.minFeeAmount = minFeeAmount;
        this.feeScale = feeScale;
    }

    /**
     * 2% on both sides, half to the referrer, cent precision.
     */
    public static FeeCalculator withDefaults() {
        return new FeeCalculator(Map.of(), DEFAULT_REFERRER_SHARE, DEFAULT_MIN_FEE, DEFAULT_FEE_SCALE);
    }

    public BigDecimal feeRate(FeeType feeType) {
        return rates.get(feeType);
    }

    public FeeSplit computeFee(Money grossAmount, FeeType feeType, boolean hasReferrer) {
        if (grossAmount == null || grossAmount.isNegative()) {
            throw new InvalidTradeSizeException("grossAmount", grossAmount == null ? null : grossAmount.toBigDecimal());
        }

        BigDecimal rawFee = grossAmount.toBigDecimal().multiply(feeRate(feeType));
        Money fee = rawFee.compareTo(minFeeAmount) < 0
            ? Money.ZERO
            : Money.of(rawFee.setScale(feeScale, RoundingMode.UP));

        Money referrerPart = hasReferrer && fee.isPositive()
            ? Money.of(fee.toBigDecimal().multiply(referrerShare).setScale(feeScale, RoundingMode.DOWN))
            : Money.ZERO;

        FeeSplit split = FeeSplit.builder()
            .grossAmount(grossAmount)
            .feeCharged(fee)
            .netAmount(grossAmount.subtract(fee))
            .referrerShare(referrerPart)
            .platformShare(fee.subtract(referrerPart))
            .build();

        log.debug("Fee computed: type={}, gross={}, fee={}, referrer={}", feeType, grossAmount, fee, referrerPart);
        return split;
    }
}
