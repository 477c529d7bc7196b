package com.prediction.market.trading.repositories;

import java.util.function.Supplier;

/**
 * Entry point for transactional writes across the market, position and wallet repositories.
 */
public interface UnitOfWork {

    /**
     * Start a transaction on the calling thread.
     *
     * @throws IllegalStateException if the thread already has one
     */
    TradeTransaction begin();

    /**
     * Run {@code work} in a new transaction and commit it; any exception rolls back.
     */
    default <T> T inTransaction(Supplier<T> work) {
        try (TradeTransaction tx = begin()) {
            T result = work.get();
            tx.commit();
            return result;
        }
    }
}
