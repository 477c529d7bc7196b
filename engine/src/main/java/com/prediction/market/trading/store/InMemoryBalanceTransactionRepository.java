package com.prediction.market.trading.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.repositories.BalanceTransactionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryBalanceTransactionRepository implements BalanceTransactionRepository {

    private final InMemoryLedgerStore store;

    @Override
    public BalanceTransaction insert(BalanceTransaction transaction) {
        if (transaction.getId() == null) {
            throw new IllegalArgumentException("Balance transaction id must be assigned before insert");
        }
        store.requireTransaction().append(transaction);
        return transaction;
    }

    @Override
    public List<BalanceTransaction> findByUserIdOrderByCreatedAtDesc(String userId) {
        List<BalanceTransaction> rows = visible();
        List<BalanceTransaction> result = new ArrayList<>();
        // committed order is append order; newest first means walking backwards
        for (int i = rows.size() - 1; i >= 0; i--) {
            if (rows.get(i).getUserId().equals(userId)) {
                result.add(rows.get(i));
            }
        }
        result.sort(Comparator.comparing(BalanceTransaction::getCreatedAt).reversed());
        return result;
    }

    @Override
    public List<BalanceTransaction> findByRelatedId(String relatedId) {
        return visible().stream()
            .filter(t -> relatedId.equals(t.getRelatedId()))
            .collect(Collectors.toList());
    }

    private List<BalanceTransaction> visible() {
        return store.read(() -> {
            List<BalanceTransaction> rows = new ArrayList<>(store.balanceTransactions());
            InMemoryTransaction tx = store.currentTransaction();
            if (tx != null) {
                rows.addAll(tx.appended());
            }
            return rows;
        });
    }
}
