package com.prediction.market.trading.store;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.repositories.PositionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryPositionRepository implements PositionRepository {

    private final InMemoryLedgerStore store;

    @Override
    public Optional<Position> findById(String positionId) {
        return store.read(() -> store.positions.find(positionId, store.currentTransaction()));
    }

    @Override
    public List<Position> findByUserIdAndMarketId(String userId, String marketId) {
        return store.read(() -> store.positions.findAll(
            p -> p.getUserId().equals(userId) && p.getMarketId().equals(marketId),
            store.currentTransaction()));
    }

    @Override
    public List<Position> findByUserId(String userId) {
        return store.read(() -> store.positions.findAll(
            p -> p.getUserId().equals(userId), store.currentTransaction()));
    }

    @Override
    public Position save(Position position) {
        InMemoryTransaction tx = store.requireTransaction();
        return store.read(() -> store.positions.save(position, tx));
    }

    @Override
    public void delete(Position position) {
        InMemoryTransaction tx = store.requireTransaction();
        store.read(() -> {
            store.positions.delete(position, tx);
            return null;
        });
    }
}
