package com.prediction.market.trading.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.TransactionType;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.exception.AccountNotFoundException;
import com.prediction.market.trading.exception.InsufficientFundsException;
import com.prediction.market.trading.exception.InvalidTradeSizeException;
import com.prediction.market.trading.support.TradingFixture;

class WalletLedgerTest {

    private final TradingFixture fixture = new TradingFixture();
    private final WalletLedger ledger = fixture.walletLedger;

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void openAccount_booksStartingBalanceAsDeposit() {
        WalletAccount account = fixture.store.inTransaction(() -> ledger.openAccount("alice", Money.of(250), "bob"));

        assertThat(account.getBalance()).isEqualByComparingTo("250");
        assertThat(account.getReferrerId()).isEqualTo("bob");
        assertThat(ledger.history("alice"))
            .singleElement()
            .satisfies(t -> {
                assertThat(t.getType()).isEqualTo(TransactionType.DEPOSIT);
                assertThat(t.getBalanceAfter()).isEqualByComparingTo("250");
            });
    }

    @Test
    void openAccount_twice_isRefused() {
        fixture.account("alice", "10");

        assertThatThrownBy(() -> fixture.account("alice", "10")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void debit_recordsBeforeAndAfter() {
        fixture.account("alice", "100");

        BalanceTransaction debit = fixture.store.inTransaction(() ->
            ledger.debit("alice", Money.of("30.5"), TransactionType.PRED_BUY, "trade-1", "m1", "Bought"));

        assertThat(debit.getAmount()).isEqualByComparingTo("30.5");
        assertThat(debit.getBalanceBefore()).isEqualByComparingTo("100");
        assertThat(debit.getBalanceAfter()).isEqualByComparingTo("69.5");
        assertThat(debit.signedAmount()).isEqualByComparingTo("-30.5");
        assertThat(fixture.balance("alice")).isEqualByComparingTo("69.5");
    }

    @Test
    void debit_beyondBalance_failsWithoutWriting() {
        fixture.account("alice", "10");

        assertThatThrownBy(() -> fixture.store.inTransaction(() ->
            ledger.debit("alice", Money.of("10.01"), TransactionType.PRED_BUY, "t", "m1", null)))
            .isInstanceOf(InsufficientFundsException.class)
            .satisfies(e -> assertThat(((InsufficientFundsException) e).getAvailable()).isEqualTo(Money.of(10)));

        assertThat(fixture.balance("alice")).isEqualByComparingTo("10");
        assertThat(ledger.history("alice")).hasSize(1);
    }

    @Test
    void debit_unknownUser_isAccountNotFound() {
        assertThatThrownBy(() -> fixture.store.inTransaction(() ->
            ledger.debit("ghost", Money.of(1), TransactionType.PRED_BUY, null, null, null)))
            .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void credit_zeroAmount_isInvalid() {
        fixture.account("alice", "10");

        assertThatThrownBy(() -> fixture.store.inTransaction(() ->
            ledger.credit("alice", Money.ZERO, TransactionType.DEPOSIT, null, null, null)))
            .isInstanceOf(InvalidTradeSizeException.class);
    }

    @Test
    void referralCredit_countsTowardsFeesEarned() {
        fixture.account("bob", "0");

        fixture.store.inTransaction(() ->
            ledger.credit("bob", Money.of("1.25"), TransactionType.REFERRAL_FEE_EARNED, "t1", "m1", "Referral"));

        WalletAccount bob = ledger.account("bob");
        assertThat(bob.getBalance()).isEqualByComparingTo("1.25");
        assertThat(bob.getTotalFeesEarned()).isEqualByComparingTo("1.25");
    }

    @Test
    void statisticsUpdates_leaveBalanceAlone() {
        fixture.account("alice", "100");

        fixture.store.inTransaction(() -> {
            ledger.recordPnL("alice", Money.of("-3.5"));
            return ledger.recordFeePaid("alice", Money.of("2"));
        });

        WalletAccount alice = ledger.account("alice");
        assertThat(alice.getBalance()).isEqualByComparingTo("100");
        assertThat(alice.getLifetimePnL()).isEqualByComparingTo("-3.5");
        assertThat(alice.getTotalFeesPaid()).isEqualByComparingTo("2");
    }

    @Test
    void referrerOf_requiresReferrerWallet() {
        fixture.account("alice", "10", "bob");
        assertThat(ledger.referrerOf("alice")).isEmpty();

        fixture.account("bob", "0");
        assertThat(ledger.referrerOf("alice")).contains("bob");
    }
}
