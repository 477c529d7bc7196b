package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A user's spendable balance and lifetime trading statistics.
 * The balance is changed only through WalletLedger debit/credit, each paired
 * with a BalanceTransaction row.
 */
@Document(collection = "wallets")
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class WalletAccount {
    @Id
    private String userId;

    private BigDecimal balance;
    private BigDecimal lifetimePnL;
    private BigDecimal totalFeesPaid;
    private BigDecimal totalFeesEarned;
    private String referrerId;
    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean hasSufficientBalance(Money amount) {
        return Money.ofNullable(balance).isGreaterThanOrEqualTo(amount);
    }

    public boolean hasReferrer() {
        return referrerId != null && !referrerId.isBlank();
    }

    public WalletAccount copy() {
        return toBuilder().build();
    }
}
