package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Immutable record of one wallet balance mutation.
 *
 * amount is always the positive magnitude; the direction follows from
 * balanceAfter - balanceBefore.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "balance_transactions")
@CompoundIndex(name = "user_created_idx", def = "{'userId':1,'createdAt':-1}")
public class BalanceTransaction {
    @Id
    private String id;

    @Indexed
    private String userId;

    private TransactionType type;
    private BigDecimal amount;
    private BigDecimal balanceBefore;
    private BigDecimal balanceAfter;

    /**
     * Trade (or other entity) that triggered the mutation.
     */
    @Indexed
    private String relatedId;

    private String marketId;
    private String description;
    private Instant createdAt;

    public BigDecimal signedAmount() {
        return balanceAfter.subtract(balanceBefore);
    }
}
