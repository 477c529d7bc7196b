package com.prediction.market.trading.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.trading.engine.FeeType;

class TradingPropertiesBindingTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(TestConfig.class);

    @Test
    void defaultsApplyWithoutProperties() {
        runner.run(context -> {
            TradingProperties properties = context.getBean(TradingProperties.class);

            assertThat(properties.getStore()).isEqualTo(TradingProperties.StoreType.MONGO);
            assertThat(properties.getSeedLiquidity()).isEqualByComparingTo("1000");
            assertThat(properties.getFees().getRates()).containsOnlyKeys(FeeType.PRED_BUY, FeeType.PRED_SELL);
            assertThat(properties.getFees().getScale()).isEqualTo(2);
            assertThat(properties.getExecution().getMaxCommitAttempts()).isEqualTo(5);
            assertThat(properties.getReconciliation().isEnabled()).isTrue();
        });
    }

    @Test
    void bindsNestedSettingsFromRelaxedProperties() {
        runner.withPropertyValues(
                "trading.store=memory",
                "trading.seed-liquidity=2500",
                "trading.liquidity-parameter=400",
                "trading.fees.rates[PRED_SELL]=0.03",
                "trading.fees.referrer-share=0.25",
                "trading.execution.retry-backoff=20ms",
                "trading.execution.commit-timeout=3s",
                "trading.reconciliation.interval=PT1M")
            .run(context -> {
                TradingProperties properties = context.getBean(TradingProperties.class);

                assertThat(properties.getStore()).isEqualTo(TradingProperties.StoreType.MEMORY);
                assertThat(properties.getSeedLiquidity()).isEqualByComparingTo("2500");
                assertThat(properties.getLiquidityParameter()).isEqualByComparingTo("400");
                assertThat(properties.getFees().getRates().get(FeeType.PRED_SELL)).isEqualByComparingTo("0.03");
                assertThat(properties.getFees().getReferrerShare()).isEqualByComparingTo("0.25");
                assertThat(properties.getExecution().getRetryBackoff()).isEqualTo(Duration.ofMillis(20));
                assertThat(properties.getExecution().getCommitTimeout()).isEqualTo(Duration.ofSeconds(3));
                assertThat(properties.getReconciliation().getInterval()).isEqualTo(Duration.ofMinutes(1));
            });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(TradingProperties.class)
    static class TestConfig {
    }
}
