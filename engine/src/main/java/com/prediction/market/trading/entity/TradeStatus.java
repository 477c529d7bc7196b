package com.prediction.market.trading.entity;

/**
 * Lifecycle of a single trade.
 *
 * State Transitions:
 *
 * VALIDATING → PRICING     (market, wallet and size checks passed)
 * VALIDATING → REJECTED
 *
 * PRICING → FEE_SPLIT      (quote computed against the current pool)
 * PRICING → REJECTED       (price bound or size rejected by the curve)
 *
 * FEE_SPLIT → COMMITTING
 * FEE_SPLIT → REJECTED
 *
 * COMMITTING → SETTLED     (unit of work committed)
 * COMMITTING → PRICING     (concurrency conflict, re-quote against fresh state)
 * COMMITTING → REJECTED    (rolled back)
 *
 * Terminal states: SETTLED, REJECTED
 */
public enum TradeStatus {

    VALIDATING,

    PRICING,

    FEE_SPLIT,

    /**
     * Writes in flight inside one unit of work. Either every ledger change
     * lands or none does.
     */
    COMMITTING,

    /**
     * TERMINAL: wallet, market and position changes are committed.
     */
    SETTLED,

    /**
     * TERMINAL: nothing was committed.
     */
    REJECTED;

    public boolean isTerminal() {
        return this == SETTLED || this == REJECTED;
    }

    public boolean canTransitionTo(TradeStatus to) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case VALIDATING -> to == PRICING || to == REJECTED;
            case PRICING -> to == FEE_SPLIT || to == REJECTED;
            case FEE_SPLIT -> to == COMMITTING || to == REJECTED;
            case COMMITTING -> to == SETTLED || to == PRICING || to == REJECTED;
            default -> false;
        };
    }
}
