package com.prediction.market.trading.store;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.repositories.MarketRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryMarketRepository implements MarketRepository {

    private final InMemoryLedgerStore store;

    @Override
    public Optional<Market> findById(String marketId) {
        return store.read(() -> store.markets.find(marketId, store.currentTransaction()));
    }

    @Override
    public List<Market> findAll() {
        return store.read(() -> store.markets.findAll(m -> true, store.currentTransaction()));
    }

    @Override
    public Market save(Market market) {
        InMemoryTransaction tx = store.requireTransaction();
        return store.read(() -> store.markets.save(market, tx));
    }
}
