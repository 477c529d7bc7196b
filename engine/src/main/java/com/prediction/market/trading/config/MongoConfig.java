package com.prediction.market.trading.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;

import com.prediction.market.trading.repositories.BalanceTransactionRepository;
import com.prediction.market.trading.repositories.MarketRepository;
import com.prediction.market.trading.repositories.PositionRepository;
import com.prediction.market.trading.repositories.QuestionRepository;
import com.prediction.market.trading.repositories.UnitOfWork;
import com.prediction.market.trading.repositories.WalletRepository;
import com.prediction.market.trading.repositories.mongo.MongoBalanceTransactionRepository;
import com.prediction.market.trading.repositories.mongo.MongoMarketRepository;
import com.prediction.market.trading.repositories.mongo.MongoPositionRepository;
import com.prediction.market.trading.repositories.mongo.MongoQuestionRepository;
import com.prediction.market.trading.repositories.mongo.MongoUnitOfWork;
import com.prediction.market.trading.repositories.mongo.MongoWalletRepository;

/**
 * MongoDB-backed ledgers. The client and template come from Spring Boot's
 * auto-configuration ({@code spring.data.mongodb.*}).
 */
@Configuration
@ConditionalOnProperty(prefix = "trading", name = "store", havingValue = "mongo", matchIfMissing = true)
public class MongoConfig {

    @Bean
    public MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public UnitOfWork unitOfWork(MongoTransactionManager transactionManager) {
        return new MongoUnitOfWork(transactionManager);
    }

    @Bean
    public MarketRepository marketRepository(MongoTemplate mongoTemplate) {
        return new MongoMarketRepository(mongoTemplate);
    }

    @Bean
    public PositionRepository positionRepository(MongoTemplate mongoTemplate) {
        return new MongoPositionRepository(mongoTemplate);
    }

    @Bean
    public WalletRepository walletRepository(MongoTemplate mongoTemplate) {
        return new MongoWalletRepository(mongoTemplate);
    }

    @Bean
    public BalanceTransactionRepository balanceTransactionRepository(MongoTemplate mongoTemplate) {
        return new MongoBalanceTransactionRepository(mongoTemplate);
    }

    @Bean
    public QuestionRepository questionRepository(MongoTemplate mongoTemplate) {
        return new MongoQuestionRepository(mongoTemplate);
    }
}
