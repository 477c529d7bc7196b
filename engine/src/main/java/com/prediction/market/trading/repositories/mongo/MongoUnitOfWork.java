package com.prediction.market.trading.repositories.mongo;

import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.repositories.TradeTransaction;
import com.prediction.market.trading.repositories.UnitOfWork;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-document MongoDB transaction per unit of work. Needs a replica set.
 *
 * MongoTemplate operations on the same thread join the session bound by the
 * transaction manager, so the repositories need no extra plumbing.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoUnitOfWork implements UnitOfWork {

    private final MongoTransactionManager transactionManager;

    @Override
    public TradeTransaction begin() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("A transaction is already active on thread " + Thread.currentThread().getName());
        }
        return new MongoTradeTransaction(transactionManager.getTransaction(TransactionDefinition.withDefaults()));
    }

    private final class MongoTradeTransaction implements TradeTransaction {

        private final TransactionStatus status;

        private MongoTradeTransaction(TransactionStatus status) {
            this.status = status;
        }

        @Override
        public void commit() {
            if (status.isCompleted()) {
                throw new IllegalStateException("Transaction is no longer active");
            }
            try {
                transactionManager.commit(status);
            } catch (TransientDataAccessException e) {
                throw new ConcurrencyConflictException("MongoDB transaction commit conflicted", e);
            } catch (TransactionSystemException e) {
                if (MongoConflicts.isTransient(e)) {
                    throw new ConcurrencyConflictException("MongoDB transaction commit conflicted", e);
                }
                throw e;
            }
        }

        @Override
        public void rollback() {
            if (!status.isCompleted()) {
                transactionManager.rollback(status);
                log.debug("MongoDB transaction rolled back");
            }
        }

        @Override
        public boolean isActive() {
            return !status.isCompleted();
        }

        @Override
        public void close() {
            rollback();
        }
    }
}
