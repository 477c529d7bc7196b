package com.prediction.market.trading.ledger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.TransactionType;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.exception.AccountNotFoundException;
import com.prediction.market.trading.exception.InsufficientFundsException;
import com.prediction.market.trading.exception.InvalidTradeSizeException;
import com.prediction.market.trading.repositories.BalanceTransactionRepository;
import com.prediction.market.trading.repositories.WalletRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wallet balances and their append-only history.
 *
 * Every balance change writes one BalanceTransaction in the same unit of work,
 * so a wallet's balance always equals the sum of its history.
 */
@Slf4j
@RequiredArgsConstructor
public class WalletLedger {

    private final WalletRepository walletRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final Clock clock;

    /**
     * Create a wallet. A positive starting balance is booked as a DEPOSIT.
     */
    public WalletAccount openAccount(String userId, Money startingBalance, String referrerId) {
        if (startingBalance.isNegative()) {
            throw new InvalidTradeSizeException("startingBalance", startingBalance.toBigDecimal());
        }
        if (walletRepository.findById(userId).isPresent()) {
            throw new IllegalArgumentException("Account already exists: " + userId);
        }
        if (userId.equals(referrerId)) {
            throw new IllegalArgumentException("A user cannot refer themselves: " + userId);
        }

        Instant now = clock.instant();
        WalletAccount account = WalletAccount.builder()
            .userId(userId)
            .balance(Money.ZERO.toBigDecimal())
            .lifetimePnL(Money.ZERO.toBigDecimal())
            .totalFeesPaid(Money.ZERO.toBigDecimal())
            .totalFeesEarned(Money.ZERO.toBigDecimal())
            .referrerId(referrerId)
            .createdAt(now)
            .updatedAt(now)
            .build();
        walletRepository.save(account);

        if (startingBalance.isPositive()) {
            credit(userId, startingBalance, TransactionType.DEPOSIT, null, null, "Starting balance");
        }
        return account(userId);
    }

    /**
     * @throws InsufficientFundsException if the balance would go negative
     */
    public BalanceTransaction debit(String userId, Money amount, TransactionType type,
                                    String relatedId, String marketId, String description) {
        requirePositive(amount);
        WalletAccount account = account(userId);
        Money before = Money.ofNullable(account.getBalance());
        if (!account.hasSufficientBalance(amount)) {
            throw new InsufficientFundsException(userId, amount, before);
        }
        return book(account, before, before.subtract(amount), amount, type, relatedId, marketId, description);
    }

    public BalanceTransaction credit(String userId, Money amount, TransactionType type,
                                     String relatedId, String marketId, String description) {
        requirePositive(amount);
        WalletAccount account = account(userId);
        if (type == TransactionType.REFERRAL_FEE_EARNED) {
            account.setTotalFeesEarned(Money.ofNullable(account.getTotalFeesEarned()).add(amount).toBigDecimal());
        }
        Money before = Money.ofNullable(account.getBalance());
        return book(account, before, before.add(amount), amount, type, relatedId, marketId, description);
    }

    public WalletAccount recordPnL(String userId, Money delta) {
        WalletAccount account = account(userId);
        account.setLifetimePnL(Money.ofNullable(account.getLifetimePnL()).add(delta).toBigDecimal());
        account.setUpdatedAt(clock.instant());
        return walletRepository.save(account);
    }

    public WalletAccount recordFeePaid(String userId, Money fee) {
        WalletAccount account = account(userId);
        account.setTotalFeesPaid(Money.ofNullable(account.getTotalFeesPaid()).add(fee).toBigDecimal());
        account.setUpdatedAt(clock.instant());
        return walletRepository.save(account);
    }

    /**
     * @throws AccountNotFoundException if the user has no wallet
     */
    public WalletAccount account(String userId) {
        return walletRepository.findById(userId).orElseThrow(() -> new AccountNotFoundException(userId));
    }

    public Optional<WalletAccount> findAccount(String userId) {
        return walletRepository.findById(userId);
    }

    public List<WalletAccount> allAccounts() {
        return walletRepository.findAll();
    }

    /**
     * Referrer that can be paid: present only if the referrer still has a wallet.
     */
    public Optional<String> referrerOf(String userId) {
        return walletRepository.findById(userId)
            .filter(WalletAccount::hasReferrer)
            .map(WalletAccount::getReferrerId)
            .filter(referrer -> walletRepository.findById(referrer).isPresent());
    }

    /**
     * Newest first.
     */
    public List<BalanceTransaction> history(String userId) {
        return balanceTransactionRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    private BalanceTransaction book(WalletAccount account, Money before, Money after, Money amount,
                                    TransactionType type, String relatedId, String marketId, String description) {
        Instant now = clock.instant();
        account.setBalance(after.toBigDecimal());
        account.setUpdatedAt(now);
        walletRepository.save(account);

        BalanceTransaction transaction = BalanceTransaction.builder()
            .id(UUID.randomUUID().toString())
            .userId(account.getUserId())
            .type(type)
            .amount(amount.toBigDecimal())
            .balanceBefore(before.toBigDecimal())
            .balanceAfter(after.toBigDecimal())
            .relatedId(relatedId)
            .marketId(marketId)
            .description(description)
            .createdAt(now)
            .build();
        balanceTransactionRepository.insert(transaction);

        log.debug("Balance {}: userId={}, amount={}, balance {} -> {}",
            type, account.getUserId(), amount, before, after);
        return transaction;
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidTradeSizeException("amount", amount == null ? null : amount.toBigDecimal());
        }
    }
}
