package com.prediction.market.trading.store;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.repositories.WalletRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryWalletRepository implements WalletRepository {

    private final InMemoryLedgerStore store;

    @Override
    public Optional<WalletAccount> findById(String userId) {
        return store.read(() -> store.wallets.find(userId, store.currentTransaction()));
    }

    @Override
    public List<WalletAccount> findAll() {
        return store.read(() -> store.wallets.findAll(w -> true, store.currentTransaction()));
    }

    @Override
    public WalletAccount save(WalletAccount account) {
        InMemoryTransaction tx = store.requireTransaction();
        return store.read(() -> store.wallets.save(account, tx));
    }
}
