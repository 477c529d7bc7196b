package com.prediction.market.trading.repositories.mongo;

import java.util.function.Supplier;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.UncategorizedMongoDbException;

import com.mongodb.MongoException;
import com.prediction.market.trading.exception.ConcurrencyConflictException;

/**
 * Maps the ways MongoDB reports a lost race onto ConcurrencyConflictException:
 * a version mismatch on save, a duplicate key on insert and a write conflict
 * between two open transactions.
 */
final class MongoConflicts {

    private MongoConflicts() {
    }

    static <T> T translate(String entity, String id, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TransientDataAccessException | DuplicateKeyException e) {
            // OptimisticLockingFailureException is a TransientDataAccessException
            throw new ConcurrencyConflictException(entity + " " + id + " changed concurrently", e);
        } catch (UncategorizedMongoDbException e) {
            if (isTransient(e)) {
                throw new ConcurrencyConflictException(entity + " " + id + " hit a write conflict", e);
            }
            throw e;
        }
    }

    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof MongoException
                    && ((MongoException) t).hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                return true;
            }
        }
        return false;
    }
}
