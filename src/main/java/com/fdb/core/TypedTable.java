package com.fdb.core;

import com.fdb.error.FdbException;
import com.fdb.mem.Table;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A raw table together with the resolution of its well-known columns.
 * <p>
 * Built once when the store is opened; immutable afterwards and safe to share between threads
 * as long as the underlying store is.
 *
 * @param <C> the column enum of this table kind
 */
public class TypedTable<C extends Enum<C> & Column> {
    private final Table raw;
    private final ColumnMap<C> columns;

    public TypedTable(Table raw, Class<C> columnType) throws FdbException {
        this.raw = Objects.requireNonNull(raw, "Table cannot be null");
        this.columns = ColumnMap.resolve(raw, columnType);
    }

    /**
     * Return the contained raw table.
     */
    public Table asRaw() {
        return raw;
    }

    public String getName() {
        return raw.name();
    }

    public ColumnMap<C> getColumns() {
        return columns;
    }

    /**
     * @return the physical index of a well-known column, empty if the table does not have it
     */
    public OptionalInt getCol(C column) {
        return columns.get(column);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + raw.name() + ", buckets=" + raw.bucketCount() + "}";
    }
}
