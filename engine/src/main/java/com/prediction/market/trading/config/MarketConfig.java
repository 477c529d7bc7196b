package com.prediction.market.trading.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.prediction.market.trading.engine.FeeCalculator;
import com.prediction.market.trading.engine.PricingCurve;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.execution.MarketExecutionRegistry;
import com.prediction.market.trading.ledger.MarketLedger;
import com.prediction.market.trading.ledger.PositionBook;
import com.prediction.market.trading.ledger.WalletLedger;
import com.prediction.market.trading.repositories.BalanceTransactionRepository;
import com.prediction.market.trading.repositories.MarketRepository;
import com.prediction.market.trading.repositories.PositionRepository;
import com.prediction.market.trading.repositories.QuestionRepository;
import com.prediction.market.trading.repositories.UnitOfWork;
import com.prediction.market.trading.repositories.WalletRepository;
import com.prediction.market.trading.service.LedgerAdminService;
import com.prediction.market.trading.service.TradeCoordinator;
import com.prediction.market.trading.service.TradeValidator;
import com.prediction.market.trading.service.WalletReconciler;

/**
 * Engine wiring. Repository and unit-of-work beans come from the store configuration
 * selected by {@code trading.store}.
 */
@Configuration
@EnableConfigurationProperties(TradingProperties.class)
public class MarketConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingCurve pricingCurve() {
        return new PricingCurve();
    }

    @Bean
    public FeeCalculator feeCalculator(TradingProperties properties) {
        TradingProperties.Fees fees = properties.getFees();
        return new FeeCalculator(fees.getRates(), fees.getReferrerShare(), fees.getMinFeeAmount(), fees.getScale());
    }

    @Bean(destroyMethod = "shutdown")
    public MarketExecutionRegistry marketExecutionRegistry(TradingProperties properties) {
        return new MarketExecutionRegistry(properties.getExecution().getCommitTimeout());
    }

    @Bean
    public MarketLedger marketLedger(MarketRepository marketRepository, QuestionRepository questionRepository,
                                     Clock clock, TradingProperties properties) {
        return new MarketLedger(marketRepository, questionRepository, clock,
            properties.getSeedLiquidity(), properties.getLiquidityParameter());
    }

    @Bean
    public PositionBook positionBook(PositionRepository positionRepository, Clock clock, TradingProperties properties) {
        return new PositionBook(positionRepository, clock, properties.getPositionEpsilon());
    }

    @Bean
    public WalletLedger walletLedger(WalletRepository walletRepository,
                                     BalanceTransactionRepository balanceTransactionRepository, Clock clock) {
        return new WalletLedger(walletRepository, balanceTransactionRepository, clock);
    }

    @Bean
    public TradeValidator tradeValidator(MarketLedger marketLedger, PositionBook positionBook, WalletLedger walletLedger) {
        return new TradeValidator(marketLedger, positionBook, walletLedger);
    }

    @Bean
    public TradeCoordinator tradeCoordinator(MarketExecutionRegistry marketExecutionRegistry, UnitOfWork unitOfWork,
                                             MarketLedger marketLedger, PositionBook positionBook,
                                             WalletLedger walletLedger, PricingCurve pricingCurve,
                                             FeeCalculator feeCalculator, TradeValidator tradeValidator,
                                             Clock clock, TradingProperties properties) {
        TradingProperties.Execution execution = properties.getExecution();
        return new TradeCoordinator(marketExecutionRegistry, unitOfWork, marketLedger, positionBook, walletLedger,
            pricingCurve, feeCalculator, tradeValidator, clock,
            execution.getMaxCommitAttempts(), execution.getRetryBackoff());
    }

    @Bean
    public LedgerAdminService ledgerAdminService(UnitOfWork unitOfWork, MarketExecutionRegistry marketExecutionRegistry,
                                                 MarketLedger marketLedger, PositionBook positionBook,
                                                 WalletLedger walletLedger, TradingProperties properties) {
        return new LedgerAdminService(unitOfWork, marketExecutionRegistry, marketLedger, positionBook, walletLedger,
            Money.of(properties.getStartingBalance()), properties.getExecution().getMaxCommitAttempts());
    }

    @Bean
    public WalletReconciler walletReconciler(WalletLedger walletLedger) {
        return new WalletReconciler(walletLedger);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "trading.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {
    }
}
