package com.prediction.market.trading.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.TransactionType;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.repositories.TradeTransaction;

class InMemoryLedgerStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private final InMemoryLedgerStore store = new InMemoryLedgerStore();
    private final InMemoryWalletRepository wallets = new InMemoryWalletRepository(store);
    private final InMemoryMarketRepository markets = new InMemoryMarketRepository(store);
    private final InMemoryPositionRepository positions = new InMemoryPositionRepository(store);
    private final InMemoryBalanceTransactionRepository history = new InMemoryBalanceTransactionRepository(store);
    private final ExecutorService otherThread = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        otherThread.shutdownNow();
    }

    private static WalletAccount wallet(String userId, String balance) {
        return WalletAccount.builder().userId(userId).balance(new BigDecimal(balance)).createdAt(NOW).build();
    }

    private static Market market(String id) {
        return Market.builder().id(id).yesPool(new BigDecimal("500")).noPool(new BigDecimal("500"))
            .liquidity(new BigDecimal("1000")).liquidityB(new BigDecimal("1000")).build();
    }

    private void seedWallet(String userId, String balance) {
        store.inTransaction(() -> wallets.save(wallet(userId, balance)));
    }

    @Test
    void writesOutsideTransaction_areRefused() {
        assertThatThrownBy(() -> wallets.save(wallet("alice", "10")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("active transaction");
    }

    @Test
    void commit_assignsVersionsAndPublishes() {
        seedWallet("alice", "10");

        WalletAccount stored = wallets.findById("alice").orElseThrow();
        assertThat(stored.getVersion()).isZero();

        stored.setBalance(new BigDecimal("7"));
        store.inTransaction(() -> wallets.save(stored));

        WalletAccount updated = wallets.findById("alice").orElseThrow();
        assertThat(updated.getVersion()).isEqualTo(1L);
        assertThat(updated.getBalance()).isEqualByComparingTo("7");
    }

    @Test
    void uncommittedWrites_areVisibleOnlyInsideTheirTransaction() throws Exception {
        try (TradeTransaction tx = store.begin()) {
            wallets.save(wallet("alice", "10"));

            assertThat(wallets.findById("alice")).isPresent();
            assertThat(otherThread.submit(() -> wallets.findById("alice").isPresent()).get()).isFalse();
        }

        assertThat(wallets.findById("alice")).isEmpty();
    }

    @Test
    void rollback_discardsEveryWrite() {
        TradeTransaction tx = store.begin();
        wallets.save(wallet("alice", "10"));
        markets.save(market("m1"));

        tx.rollback();

        assertThat(tx.isActive()).isFalse();
        assertThat(wallets.findById("alice")).isEmpty();
        assertThat(markets.findById("m1")).isEmpty();
    }

    @Test
    void staleSave_failsImmediately() throws Exception {
        seedWallet("alice", "10");
        WalletAccount stale = wallets.findById("alice").orElseThrow();

        otherThread.submit(() -> {
            WalletAccount fresh = wallets.findById("alice").orElseThrow();
            fresh.setBalance(new BigDecimal("3"));
            return store.inTransaction(() -> wallets.save(fresh));
        }).get();

        try (TradeTransaction tx = store.begin()) {
            stale.setBalance(new BigDecimal("1"));
            assertThatThrownBy(() -> wallets.save(stale)).isInstanceOf(ConcurrencyConflictException.class);
        }
        assertThat(wallets.findById("alice").orElseThrow().getBalance()).isEqualByComparingTo("3");
    }

    @Test
    void conflictingCommit_appliesNothingToAnyTable() throws Exception {
        seedWallet("alice", "10");

        TradeTransaction tx = store.begin();
        WalletAccount mine = wallets.findById("alice").orElseThrow();
        mine.setBalance(new BigDecimal("5"));
        wallets.save(mine);
        markets.save(market("m1"));
        positions.save(Position.builder().id(Position.idFor("alice", "m1", Outcome.NO))
            .userId("alice").marketId("m1").side(Outcome.NO)
            .shares(BigDecimal.ONE).avgPrice(new BigDecimal("0.5")).build());

        otherThread.submit(() -> {
            WalletAccount theirs = wallets.findById("alice").orElseThrow();
            theirs.setBalance(new BigDecimal("8"));
            return store.inTransaction(() -> wallets.save(theirs));
        }).get();

        assertThatThrownBy(tx::commit).isInstanceOf(ConcurrencyConflictException.class);
        assertThat(tx.isActive()).isFalse();
        assertThat(wallets.findById("alice").orElseThrow().getBalance()).isEqualByComparingTo("8");
        assertThat(markets.findById("m1")).isEmpty();
        assertThat(positions.findByUserId("alice")).isEmpty();
    }

    @Test
    void duplicateInsert_conflicts() throws Exception {
        try (TradeTransaction tx = store.begin()) {
            markets.save(market("m1"));

            otherThread.submit(() -> store.inTransaction(() -> markets.save(market("m1")))).get();

            assertThatThrownBy(tx::commit).isInstanceOf(ConcurrencyConflictException.class);
        }
        assertThat(markets.findById("m1").orElseThrow().getVersion()).isZero();
    }

    @Test
    void repeatedSavesInOneTransaction_chainVersions() {
        seedWallet("alice", "10");

        store.inTransaction(() -> {
            WalletAccount first = wallets.findById("alice").orElseThrow();
            first.setBalance(new BigDecimal("9"));
            wallets.save(first);
            WalletAccount second = wallets.findById("alice").orElseThrow();
            second.setBalance(new BigDecimal("8"));
            return wallets.save(second);
        });

        WalletAccount stored = wallets.findById("alice").orElseThrow();
        assertThat(stored.getBalance()).isEqualByComparingTo("8");
        assertThat(stored.getVersion()).isEqualTo(2L);
    }

    @Test
    void delete_removesRowOnCommit() {
        Position position = Position.builder().id(Position.idFor("alice", "m1", Outcome.YES))
            .userId("alice").marketId("m1").side(Outcome.YES)
            .shares(BigDecimal.TEN).avgPrice(new BigDecimal("0.5")).build();
        store.inTransaction(() -> positions.save(position));

        Position stored = positions.findByUserIdAndMarketId("alice", "m1").get(0);
        try (TradeTransaction tx = store.begin()) {
            positions.delete(stored);
            assertThat(positions.findByUserId("alice")).isEmpty();
            tx.commit();
        }

        assertThat(positions.findById(stored.getId())).isEmpty();
    }

    @Test
    void balanceTransactions_appearOnCommitNewestFirst() {
        BalanceTransaction first = BalanceTransaction.builder().id("t1").userId("alice")
            .type(TransactionType.DEPOSIT).amount(BigDecimal.TEN)
            .balanceBefore(BigDecimal.ZERO).balanceAfter(BigDecimal.TEN).createdAt(NOW).build();
        BalanceTransaction second = BalanceTransaction.builder().id("t2").userId("alice")
            .type(TransactionType.PRED_BUY).amount(BigDecimal.ONE)
            .balanceBefore(BigDecimal.TEN).balanceAfter(new BigDecimal("9")).createdAt(NOW).build();

        try (TradeTransaction tx = store.begin()) {
            history.insert(first);
            history.insert(second);
        }
        assertThat(history.findByUserIdOrderByCreatedAtDesc("alice")).isEmpty();

        store.inTransaction(() -> {
            history.insert(first);
            return history.insert(second);
        });

        assertThat(history.findByUserIdOrderByCreatedAtDesc("alice"))
            .extracting(BalanceTransaction::getId)
            .containsExactly("t2", "t1");
    }

    @Test
    void nestedBegin_onSameThread_isRefused() {
        try (TradeTransaction tx = store.begin()) {
            assertThatThrownBy(store::begin).isInstanceOf(IllegalStateException.class);
        }
    }
}
