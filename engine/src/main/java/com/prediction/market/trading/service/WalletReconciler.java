package com.prediction.market.trading.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.ledger.WalletLedger;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic audit: every wallet's balance must equal the sum of its balance transactions.
 *
 * Drift is reported, never corrected; the ledger writes both in one unit of work,
 * so a mismatch points at an out-of-band edit that needs a human.
 */
@Slf4j
@RequiredArgsConstructor
public class WalletReconciler {

    private final WalletLedger walletLedger;

    @Value
    public static class Drift {
        String userId;
        BigDecimal balance;
        BigDecimal ledgerBalance;
    }

    @Scheduled(fixedDelayString = "${trading.reconciliation.interval:PT5M}",
               initialDelayString = "${trading.reconciliation.interval:PT5M}")
    public void scheduledReconcile() {
        try {
            reconcileAll();
        } catch (RuntimeException e) {
            log.error("Wallet reconciliation failed: {}", e.getMessage(), e);
        }
    }

    public List<Drift> reconcileAll() {
        log.info("Starting wallet reconciliation...");
        List<Drift> drifts = new ArrayList<>();
        List<WalletAccount> accounts = walletLedger.allAccounts();

        for (WalletAccount account : accounts) {
            BigDecimal ledgerBalance = ledgerBalance(account.getUserId());
            BigDecimal balance = account.getBalance() == null ? BigDecimal.ZERO : account.getBalance();
            if (balance.compareTo(ledgerBalance) != 0) {
                log.warn("Balance drift detected: userId={}, balance={}, ledger={}",
                    account.getUserId(), balance, ledgerBalance);
                drifts.add(new Drift(account.getUserId(), balance, ledgerBalance));
            }
        }

        log.info("Wallet reconciliation complete: {} accounts checked, {} drifted", accounts.size(), drifts.size());
        return drifts;
    }

    public BigDecimal ledgerBalance(String userId) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BalanceTransaction transaction : walletLedger.history(userId)) {
            sum = sum.add(transaction.signedAmount());
        }
        return sum;
    }
}
