package com.prediction.market.trading.repositories;

import java.util.List;

import com.prediction.market.trading.entity.BalanceTransaction;

/**
 * Append-only balance history.
 */
public interface BalanceTransactionRepository {

    /**
     * Requires an active transaction; the row becomes visible to others on commit.
     */
    BalanceTransaction insert(BalanceTransaction transaction);

    /**
     * Newest first.
     */
    List<BalanceTransaction> findByUserIdOrderByCreatedAtDesc(String userId);

    List<BalanceTransaction> findByRelatedId(String relatedId);
}
