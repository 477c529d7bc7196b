package com.prediction.market.trading.exception;

/**
 * Transient: a row changed between the read that priced the trade and its commit.
 * Retried inside TradeCoordinator; callers only see {@link TradeConflictException}.
 */
public class ConcurrencyConflictException extends TradeException {

    public ConcurrencyConflictException(String entity, String id, Object expectedVersion, Object actualVersion) {
        super("CONCURRENCY_CONFLICT",
            String.format("%s %s changed concurrently (expected version %s, found %s)",
                entity, id, expectedVersion, actualVersion),
            context("entity", entity, "id", id, "expectedVersion", expectedVersion, "actualVersion", actualVersion));
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super("CONCURRENCY_CONFLICT", message, context(), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
