package com.prediction.market.trading.repositories.mongo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.MongoTemplate;

import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.repositories.MarketRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoMarketRepository implements MarketRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Market> findById(String marketId) {
        return Optional.ofNullable(mongoTemplate.findById(marketId, Market.class));
    }

    @Override
    public List<Market> findAll() {
        return mongoTemplate.findAll(Market.class);
    }

    @Override
    public Market save(Market market) {
        return MongoConflicts.translate("Market", market.getId(), () -> mongoTemplate.save(market));
    }
}
