package com.prediction.market.trading.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.Question;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.repositories.TradeTransaction;
import com.prediction.market.trading.repositories.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Transactional in-memory backing for the ledger repositories.
 *
 * Each transaction buffers its writes (and reads its own writes). On commit every
 * buffered row is checked against the committed version it was written over; if
 * any row moved, nothing is applied and a ConcurrencyConflictException is thrown.
 * Commits and committed reads are serialized by a read/write lock, so readers
 * never observe half of a commit.
 *
 * Questions are not transactional; they are registered directly by whoever owns
 * them (tests, bootstrap code).
 */
@Slf4j
public class InMemoryLedgerStore implements UnitOfWork {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ThreadLocal<InMemoryTransaction> current = new ThreadLocal<>();

    final VersionedTable<Market> markets = new VersionedTable<>("Market",
        Market::getId, Market::getVersion, Market::setVersion, Market::copy,
        InMemoryTransaction::marketWrites);
    final VersionedTable<Position> positions = new VersionedTable<>("Position",
        Position::getId, Position::getVersion, Position::setVersion, Position::copy,
        InMemoryTransaction::positionWrites);
    final VersionedTable<WalletAccount> wallets = new VersionedTable<>("WalletAccount",
        WalletAccount::getUserId, WalletAccount::getVersion, WalletAccount::setVersion, WalletAccount::copy,
        InMemoryTransaction::walletWrites);

    private final List<BalanceTransaction> balanceTransactions = new ArrayList<>();
    private final Map<String, Question> questions = new ConcurrentHashMap<>();

    @Override
    public TradeTransaction begin() {
        if (current.get() != null) {
            throw new IllegalStateException("A transaction is already active on thread " + Thread.currentThread().getName());
        }
        InMemoryTransaction tx = new InMemoryTransaction(this);
        current.set(tx);
        return tx;
    }

    public void registerQuestion(Question question) {
        questions.put(question.getId(), question);
    }

    Map<String, Question> questions() {
        return Collections.unmodifiableMap(questions);
    }

    /**
     * Active transaction of the calling thread, or null.
     */
    InMemoryTransaction currentTransaction() {
        return current.get();
    }

    InMemoryTransaction requireTransaction() {
        InMemoryTransaction tx = current.get();
        if (tx == null) {
            throw new IllegalStateException("Ledger writes require an active transaction");
        }
        return tx;
    }

    <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    List<BalanceTransaction> balanceTransactions() {
        return balanceTransactions;
    }

    void commit(InMemoryTransaction tx) {
        lock.writeLock().lock();
        try {
            markets.verify(tx.marketWrites());
            positions.verify(tx.positionWrites());
            wallets.verify(tx.walletWrites());

            markets.apply(tx.marketWrites());
            positions.apply(tx.positionWrites());
            wallets.apply(tx.walletWrites());
            balanceTransactions.addAll(tx.appended());
            log.debug("In-memory transaction committed: rows={}, balanceTransactions={}",
                tx.pendingRows(), tx.appended().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    void release(InMemoryTransaction tx) {
        if (current.get() == tx) {
            current.remove();
        }
    }
}
