package com.prediction.market.trading.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.trading.repositories.BalanceTransactionRepository;
import com.prediction.market.trading.repositories.MarketRepository;
import com.prediction.market.trading.repositories.PositionRepository;
import com.prediction.market.trading.repositories.QuestionRepository;
import com.prediction.market.trading.repositories.WalletRepository;
import com.prediction.market.trading.store.InMemoryBalanceTransactionRepository;
import com.prediction.market.trading.store.InMemoryLedgerStore;
import com.prediction.market.trading.store.InMemoryMarketRepository;
import com.prediction.market.trading.store.InMemoryPositionRepository;
import com.prediction.market.trading.store.InMemoryQuestionRepository;
import com.prediction.market.trading.store.InMemoryWalletRepository;

@Configuration
@ConditionalOnProperty(prefix = "trading", name = "store", havingValue = "memory")
public class InMemoryStoreConfig {

    @Bean
    public InMemoryLedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    public MarketRepository marketRepository(InMemoryLedgerStore store) {
        return new InMemoryMarketRepository(store);
    }

    @Bean
    public PositionRepository positionRepository(InMemoryLedgerStore store) {
        return new InMemoryPositionRepository(store);
    }

    @Bean
    public WalletRepository walletRepository(InMemoryLedgerStore store) {
        return new InMemoryWalletRepository(store);
    }

    @Bean
    public BalanceTransactionRepository balanceTransactionRepository(InMemoryLedgerStore store) {
        return new InMemoryBalanceTransactionRepository(store);
    }

    @Bean
    public QuestionRepository questionRepository(InMemoryLedgerStore store) {
        return new InMemoryQuestionRepository(store);
    }
}
