package com.prediction.market.trading.repositories;

/**
 * One atomic batch of ledger writes, bound to the thread that began it.
 *
 * Closing a transaction that was not committed rolls it back, so it is normally
 * used in a try-with-resources block.
 */
public interface TradeTransaction extends AutoCloseable {

    /**
     * @throws com.prediction.market.trading.exception.ConcurrencyConflictException if another
     *         transaction committed a conflicting write first; nothing is applied in that case
     */
    void commit();

    void rollback();

    boolean isActive();

    @Override
    void close();
}
