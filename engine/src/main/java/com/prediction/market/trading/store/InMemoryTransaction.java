package com.prediction.market.trading.store;

import java.util.ArrayList;
import java.util.List;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.repositories.TradeTransaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Write buffer of one in-memory transaction. Confined to the thread that began it.
 */
@Slf4j
final class InMemoryTransaction implements TradeTransaction {

    private final InMemoryLedgerStore store;
    private final TableWrites<Market> marketWrites = new TableWrites<>();
    private final TableWrites<Position> positionWrites = new TableWrites<>();
    private final TableWrites<WalletAccount> walletWrites = new TableWrites<>();
    private final List<BalanceTransaction> appended = new ArrayList<>();
    private boolean active = true;

    InMemoryTransaction(InMemoryLedgerStore store) {
        this.store = store;
    }

    TableWrites<Market> marketWrites() {
        return marketWrites;
    }

    TableWrites<Position> positionWrites() {
        return positionWrites;
    }

    TableWrites<WalletAccount> walletWrites() {
        return walletWrites;
    }

    int pendingRows() {
        return marketWrites.all().size() + positionWrites.all().size() + walletWrites.all().size();
    }

    void append(BalanceTransaction transaction) {
        appended.add(transaction);
    }

    List<BalanceTransaction> appended() {
        return appended;
    }

    @Override
    public void commit() {
        requireActive();
        try {
            store.commit(this);
        } finally {
            active = false;
            store.release(this);
        }
    }

    @Override
    public void rollback() {
        if (!active) {
            return;
        }
        active = false;
        marketWrites.clear();
        positionWrites.clear();
        walletWrites.clear();
        appended.clear();
        store.release(this);
        log.debug("In-memory transaction rolled back");
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        if (active) {
            rollback();
        }
    }

    private void requireActive() {
        if (!active) {
            throw new IllegalStateException("Transaction is no longer active");
        }
    }
}
