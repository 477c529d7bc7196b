package com.prediction.market.trading.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.prediction.market.trading.engine.FeeCalculator;
import com.prediction.market.trading.engine.FeeType;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings under {@code trading.*}.
 */
@ConfigurationProperties(prefix = "trading")
@Getter
@Setter
public class TradingProperties {

    public enum StoreType {
        MEMORY,
        MONGO
    }

    /** Backing store for the ledgers. MONGO needs a replica set for transactions. */
    private StoreType store = StoreType.MONGO;

    /** Cash a lazily materialized market starts with, split evenly between YES and NO. */
    private BigDecimal seedLiquidity = new BigDecimal("1000");

    /** Curve depth b: buying 2b shares moves a side's price by one whole unit. */
    private BigDecimal liquidityParameter = new BigDecimal("1000");

    /** Balance credited to a new wallet when none is given. */
    private BigDecimal startingBalance = new BigDecimal("1000");

    /** Holdings below this many shares are deleted. */
    private BigDecimal positionEpsilon = new BigDecimal("0.000001");

    private Fees fees = new Fees();
    private Execution execution = new Execution();
    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Fees {
        private Map<FeeType, BigDecimal> rates = defaultRates();
        private BigDecimal referrerShare = FeeCalculator.DEFAULT_REFERRER_SHARE;
        /** Unrounded fees below this are waived. */
        private BigDecimal minFeeAmount = FeeCalculator.DEFAULT_MIN_FEE;
        /** Fee precision in decimal places. */
        private int scale = FeeCalculator.DEFAULT_FEE_SCALE;

        private static Map<FeeType, BigDecimal> defaultRates() {
            Map<FeeType, BigDecimal> rates = new EnumMap<>(FeeType.class);
            rates.put(FeeType.PRED_BUY, FeeCalculator.DEFAULT_RATE);
            rates.put(FeeType.PRED_SELL, FeeCalculator.DEFAULT_RATE);
            return rates;
        }
    }

    @Getter
    @Setter
    public static class Execution {
        /** Commit attempts per trade before a TradeConflict is reported. */
        private int maxCommitAttempts = 5;
        /** Sleep before a retry, multiplied by the attempt number. */
        private Duration retryBackoff = Duration.ofMillis(5);
        /** How long a caller waits for its trade to settle. */
        private Duration commitTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
    }
}
