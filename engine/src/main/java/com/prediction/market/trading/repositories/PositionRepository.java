package com.prediction.market.trading.repositories;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.Position;

/**
 * Position rows, keyed by {@link Position#idFor}. Same versioning rules as {@link MarketRepository}.
 */
public interface PositionRepository {

    Optional<Position> findById(String positionId);

    List<Position> findByUserIdAndMarketId(String userId, String marketId);

    List<Position> findByUserId(String userId);

    Position save(Position position);

    void delete(Position position);
}
