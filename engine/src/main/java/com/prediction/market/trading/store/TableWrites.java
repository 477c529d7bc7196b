package com.prediction.market.trading.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pending writes of one transaction against one table.
 */
final class TableWrites<E> {

    static final class Pending<E> {
        final Long baseVersion;   // committed version the write was made against, null for inserts
        E value;                  // null once deleted

        Pending(Long baseVersion, E value) {
            this.baseVersion = baseVersion;
            this.value = value;
        }

        boolean isDeleted() {
            return value == null;
        }
    }

    private final Map<String, Pending<E>> pending = new LinkedHashMap<>();

    Pending<E> get(String id) {
        return pending.get(id);
    }

    void put(String id, Pending<E> write) {
        pending.put(id, write);
    }

    Map<String, Pending<E>> all() {
        return pending;
    }

    void clear() {
        pending.clear();
    }
}
