package com.prediction.market.trading.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import com.prediction.market.trading.dto.BuyReceipt;
import com.prediction.market.trading.engine.FeeCalculator;
import com.prediction.market.trading.engine.FeeType;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Question;
import com.prediction.market.trading.entity.QuestionStatus;
import com.prediction.market.trading.repositories.UnitOfWork;
import com.prediction.market.trading.repositories.mongo.MongoUnitOfWork;
import com.prediction.market.trading.service.LedgerAdminService;
import com.prediction.market.trading.service.TradeCoordinator;
import com.prediction.market.trading.store.InMemoryLedgerStore;

class MarketConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(MarketConfig.class, InMemoryStoreConfig.class, MongoConfig.class);

    @Test
    void memoryStore_wiresEngineThatTrades() {
        runner.withPropertyValues("trading.store=memory", "trading.reconciliation.enabled=false",
                "trading.fees.rates[PRED_BUY]=0.05")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(UnitOfWork.class)).isInstanceOf(InMemoryLedgerStore.class);
                assertThat(context).doesNotHaveBean(MongoUnitOfWork.class);
                assertThat(context).doesNotHaveBean(MarketConfig.SchedulingConfig.class);
                assertThat(context.getBean(FeeCalculator.class).feeRate(FeeType.PRED_BUY)).isEqualByComparingTo("0.05");

                context.getBean(InMemoryLedgerStore.class).registerQuestion(Question.builder()
                    .id("q1")
                    .questionNumber(1)
                    .text("Will it ship?")
                    .status(QuestionStatus.ACTIVE)
                    .resolutionDate(Instant.now().plus(1, ChronoUnit.DAYS))
                    .createdDate(Instant.now())
                    .build());
                context.getBean(LedgerAdminService.class).openAccount("alice", null);

                BuyReceipt receipt = context.getBean(TradeCoordinator.class)
                    .buy("alice", "q1", Outcome.YES, new BigDecimal("100"));

                assertThat(receipt.getFeeCharged()).isEqualByComparingTo("5.00");
                assertThat(receipt.getNewBalance()).isEqualByComparingTo("900");
            });
    }

    @Test
    void reconciliationEnabledByDefault_turnsOnScheduling() {
        runner.withPropertyValues("trading.store=memory")
            .run(context -> assertThat(context).hasSingleBean(MarketConfig.SchedulingConfig.class));
    }

    @Test
    void mongoStore_isTheDefault() {
        runner.withConfiguration(AutoConfigurations.of(MongoAutoConfiguration.class, MongoDataAutoConfiguration.class))
            .withPropertyValues("spring.data.mongodb.uri=mongodb://localhost:27017/trading_test",
                "trading.reconciliation.enabled=false")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(UnitOfWork.class)).isInstanceOf(MongoUnitOfWork.class);
                assertThat(context).doesNotHaveBean(InMemoryLedgerStore.class);
            });
    }
}
