package com.prediction.market.trading.repositories.mongo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.mongodb.UncategorizedMongoDbException;

import com.mongodb.MongoException;
import com.prediction.market.trading.exception.ConcurrencyConflictException;

class MongoConflictsTest {

    @Test
    void translate_passesResultThrough() {
        assertThat(MongoConflicts.translate("Market", "m1", () -> "saved")).isEqualTo("saved");
    }

    @Test
    void translate_versionMismatch_isConflict() {
        assertThatThrownBy(() -> MongoConflicts.translate("Market", "m1", () -> {
            throw new OptimisticLockingFailureException("version 3 expected");
        }))
            .isInstanceOf(ConcurrencyConflictException.class)
            .hasMessageContaining("Market m1")
            .hasCauseInstanceOf(OptimisticLockingFailureException.class);
    }

    @Test
    void translate_duplicateKey_isConflict() {
        assertThatThrownBy(() -> MongoConflicts.translate("Position", "alice:m1:YES", () -> {
            throw new DuplicateKeyException("E11000");
        })).isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void translate_transactionWriteConflict_isConflict() {
        MongoException writeConflict = new MongoException(112, "WriteConflict");
        writeConflict.addLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);

        assertThatThrownBy(() -> MongoConflicts.translate("WalletAccount", "alice", () -> {
            throw new UncategorizedMongoDbException("write conflict", writeConflict);
        }))
            .isInstanceOf(ConcurrencyConflictException.class)
            .satisfies(e -> assertThat(((ConcurrencyConflictException) e).isRetryable()).isTrue());
    }

    @Test
    void translate_otherMongoFailure_isRethrown() {
        UncategorizedMongoDbException failure =
            new UncategorizedMongoDbException("disk full", new MongoException(14031, "disk full"));

        assertThatThrownBy(() -> MongoConflicts.translate("Market", "m1", () -> {
            throw failure;
        })).isSameAs(failure);
    }
}
