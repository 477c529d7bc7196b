package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import lombok.Getter;
import lombok.ToString;

/**
 * In-flight state of one buy or sell as it moves through the trade state machine.
 *
 * Not persisted: the committed effects live in the ledgers and the balance
 * transactions reference {@link #getTradeId()}.
 */
@Getter
@ToString
public class TradeExecution {

    private final String tradeId;
    private final String userId;
    private final String marketId;
    private final TradeDirection direction;
    private final BigDecimal requestedSize;
    private final Clock clock;

    private Outcome side;
    private TradeStatus status = TradeStatus.VALIDATING;
    private int attempts;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private String rejectionReason;

    public TradeExecution(String userId, String marketId, TradeDirection direction, Outcome side,
            BigDecimal requestedSize, Clock clock) {
        this.tradeId = UUID.randomUUID().toString();
        this.userId = userId;
        this.marketId = marketId;
        this.direction = direction;
        this.side = side;
        this.requestedSize = requestedSize;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = this.createdAt;
    }

    /**
     * Transition to a new status with validation.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(TradeStatus newStatus) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid trade state transition: %s → %s (tradeId=%s)",
                    this.status, newStatus, this.tradeId)
            );
        }

        if (newStatus == TradeStatus.PRICING) {
            attempts++;
        }
        this.status = newStatus;
        this.updatedAt = clock.instant();

        if (newStatus.isTerminal()) {
            this.completedAt = this.updatedAt;
        }
    }

    public void reject(String reason) {
        this.transitionTo(TradeStatus.REJECTED);
        this.rejectionReason = reason;
    }

    /**
     * Sells against "the" open position learn their side during validation.
     */
    public void resolveSide(Outcome side) {
        if (this.side != null && this.side != side) {
            throw new IllegalStateException("Trade side already set to " + this.side + " (tradeId=" + tradeId + ")");
        }
        this.side = side;
    }

    public boolean isSettled() {
        return status == TradeStatus.SETTLED;
    }
}
