package com.fdb.core;

import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

import java.util.Collections;
import java.util.Optional;

/**
 * A typed table whose rows can be projected into a typed row class.
 *
 * @param <C> the column enum of this table kind
 * @param <R> the typed row class
 */
public abstract class TypedRowTable<C extends Enum<C> & Column, R extends TypedRow<C, R>> extends TypedTable<C> {

    protected TypedRowTable(Table raw, Class<C> columnType) throws FdbException {
        super(raw, columnType);
    }

    /**
     * Create a typed row from a raw row of this table.
     */
    protected abstract R wrap(Row row);

    /**
     * All rows of the table, bucket by bucket in stored order. Every call to {@code iterator()} starts over.
     */
    public Iterable<R> rows() {
        return () -> new RowIter<>(asRaw().rowIterator(), this::wrap);
    }

    /**
     * The rows of the bucket that {@code key} hashes to, in stored order.
     * <p>
     * Rows are not filtered by key: a bucket holds every row whose key shares its hash. Callers that need
     * exact-key semantics compare the key column themselves.
     */
    public Iterable<R> keyRows(int key) {
        return () -> {
            var bucket = Lookups.bucketFor(asRaw(), key);
            if (bucket == null) return Collections.emptyIterator();
            return new RowIter<>(bucket.rows().iterator(), this::wrap);
        };
    }

    /**
     * First row whose {@code idColumn} equals {@code key}, searching the bucket selected by {@code indexKey}.
     * <p>
     * {@code indexKey} must be the value the rows were bucketed by (the first column); {@code key} may belong
     * to a different column only when that column's value agrees with the bucketing.
     */
    protected Optional<R> get(int indexKey, int key, C idColumn) {
        var row = Lookups.findFirst(asRaw(), indexKey, key, getColumns().require(idColumn));
        return Optional.ofNullable(row).map(this::wrap);
    }
}
