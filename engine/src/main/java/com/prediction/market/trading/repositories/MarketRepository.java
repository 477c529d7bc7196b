package com.prediction.market.trading.repositories;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.Market;

/**
 * Market rows. {@link #save} is version-checked: a market carrying a null version
 * is inserted, otherwise the stored version must match or a
 * {@link com.prediction.market.trading.exception.ConcurrencyConflictException} is raised.
 */
public interface MarketRepository {

    Optional<Market> findById(String marketId);

    List<Market> findAll();

    /**
     * Requires an active transaction. Bumps the version on the passed entity and returns it.
     */
    Market save(Market market);
}
