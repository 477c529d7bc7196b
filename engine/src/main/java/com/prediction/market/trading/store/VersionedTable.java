package com.prediction.market.trading.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.store.TableWrites.Pending;

/**
 * Committed rows of one entity type plus the optimistic version rules.
 *
 * Rows are stored and handed out as copies, so no caller ever holds a reference
 * into committed state. Must be accessed under the owning store's lock.
 */
final class VersionedTable<E> {

    private final String entityName;
    private final Function<E, String> idOf;
    private final Function<E, Long> versionOf;
    private final BiConsumer<E, Long> versionSetter;
    private final UnaryOperator<E> copier;
    private final Function<InMemoryTransaction, TableWrites<E>> writesOf;

    private final Map<String, E> rows = new HashMap<>();

    VersionedTable(String entityName, Function<E, String> idOf, Function<E, Long> versionOf,
                   BiConsumer<E, Long> versionSetter, UnaryOperator<E> copier,
                   Function<InMemoryTransaction, TableWrites<E>> writesOf) {
        this.entityName = entityName;
        this.idOf = idOf;
        this.versionOf = versionOf;
        this.versionSetter = versionSetter;
        this.copier = copier;
        this.writesOf = writesOf;
    }

    String entityName() {
        return entityName;
    }

    Optional<E> find(String id, InMemoryTransaction tx) {
        if (tx != null) {
            Pending<E> pending = writesOf.apply(tx).get(id);
            if (pending != null) {
                return Optional.ofNullable(pending.value).map(copier);
            }
        }
        return Optional.ofNullable(rows.get(id)).map(copier);
    }

    List<E> findAll(Predicate<E> filter, InMemoryTransaction tx) {
        Map<String, E> view = new LinkedHashMap<>(rows);
        if (tx != null) {
            writesOf.apply(tx).all().forEach((id, pending) -> {
                if (pending.isDeleted()) {
                    view.remove(id);
                } else {
                    view.put(id, pending.value);
                }
            });
        }
        List<E> result = new ArrayList<>();
        for (E row : view.values()) {
            if (filter.test(row)) {
                result.add(copier.apply(row));
            }
        }
        return result;
    }

    E save(E entity, InMemoryTransaction tx) {
        String id = Objects.requireNonNull(idOf.apply(entity), entityName + " id");
        Long version = versionOf.apply(entity);
        TableWrites<E> writes = writesOf.apply(tx);
        Pending<E> pending = writes.get(id);

        if (pending == null) {
            checkCommitted(id, version);
            pending = new Pending<>(version, null);
            writes.put(id, pending);
        } else {
            Long current = pending.isDeleted() ? null : versionOf.apply(pending.value);
            if (pending.isDeleted() ? version != null : !Objects.equals(current, version)) {
                throw new ConcurrencyConflictException(entityName, id, version, current);
            }
        }

        Long next = version == null ? 0L : version + 1;
        versionSetter.accept(entity, next);
        pending.value = copier.apply(entity);
        return entity;
    }

    void delete(E entity, InMemoryTransaction tx) {
        String id = idOf.apply(entity);
        Long version = versionOf.apply(entity);
        TableWrites<E> writes = writesOf.apply(tx);
        Pending<E> pending = writes.get(id);

        if (pending == null) {
            if (version == null) {
                throw new ConcurrencyConflictException(entityName, id, null, null);
            }
            checkCommitted(id, version);
            writes.put(id, new Pending<>(version, null));
            return;
        }
        Long current = pending.isDeleted() ? null : versionOf.apply(pending.value);
        if (pending.isDeleted() || !Objects.equals(current, version)) {
            throw new ConcurrencyConflictException(entityName, id, version, current);
        }
        pending.value = null;
    }

    /**
     * Fails if any pending write was made against a version that is no longer committed.
     */
    void verify(TableWrites<E> writes) {
        writes.all().forEach((id, pending) -> checkCommitted(id, pending.baseVersion));
    }

    void apply(TableWrites<E> writes) {
        writes.all().forEach((id, pending) -> {
            if (pending.isDeleted()) {
                rows.remove(id);
            } else {
                rows.put(id, pending.value);
            }
        });
    }

    int size() {
        return rows.size();
    }

    private void checkCommitted(String id, Long expectedVersion) {
        E committed = rows.get(id);
        Long actual = committed == null ? null : versionOf.apply(committed);
        boolean matches = expectedVersion == null
            ? committed == null
            : committed != null && expectedVersion.equals(actual);
        if (!matches) {
            throw new ConcurrencyConflictException(entityName, id, expectedVersion,
                committed == null ? "absent" : actual);
        }
    }
}
