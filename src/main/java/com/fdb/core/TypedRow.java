package com.fdb.core;

import com.fdb.mem.Row;
import com.fdb.types.Field;
import com.fdb.types.Latin1Str;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A raw row bound to the typed table it belongs to.
 * <p>
 * Typed rows are cheap, transient projections: they own no data, and text accessors return views into the
 * store's buffer. Do not keep a typed row, or any {@link Latin1Str} obtained from it, beyond the lifetime of
 * the store.
 * <p>
 * Accessors of required columns treat a missing value or an unexpected variant as a broken schema contract and
 * throw {@link IllegalStateException}. Accessors of optional columns return null instead.
 *
 * @param <C> the column enum of the table kind
 * @param <R> the concrete row class
 */
public abstract class TypedRow<C extends Enum<C> & Column, R extends TypedRow<C, R>> {
    private final Row inner;
    private final TypedTable<C> table;

    protected TypedRow(Row inner, TypedTable<C> table) {
        this.inner = Objects.requireNonNull(inner, "Row cannot be null");
        this.table = Objects.requireNonNull(table, "Table cannot be null");
    }

    public Row asRaw() {
        return inner;
    }

    public TypedTable<C> getTable() {
        return table;
    }

    /**
     * @return the name of this row kind's serialized structure
     */
    public abstract String structName();

    /**
     * @return the serialized fields of this row kind, in declaration order
     */
    protected abstract List<RowField<R>> rowFields();

    @SuppressWarnings("unchecked")
    private R self() {
        return (R) this;
    }

    public List<String> fieldNames() {
        var fields = rowFields();
        var names = new ArrayList<String>(fields.size());
        for (var field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    /**
     * Structured view of the row: every declared field in declaration order, keyed by its human-readable name.
     * Absent optional values are present as null entries. Text is decoded into owned strings.
     */
    public Map<String, Object> toMap() {
        var fields = rowFields();
        var map = new LinkedHashMap<String, Object>(fields.size() * 2);
        for (var field : fields) {
            var value = field.read(self());
            map.put(field.getName(), value instanceof Latin1Str ? ((Latin1Str) value).decode() : value);
        }
        return map;
    }

    // ========== REQUIRED COLUMNS ==========

    protected int requireInt(C column) {
        var value = requireField(column).asInteger();
        if (value == null) throw mismatch(column, "INTEGER");
        return value;
    }

    protected float requireFloat(C column) {
        var value = requireField(column).asFloat();
        if (value == null) throw mismatch(column, "FLOAT");
        return value;
    }

    protected boolean requireBool(C column) {
        var value = requireField(column).asBoolean();
        if (value == null) throw mismatch(column, "BOOLEAN");
        return value;
    }

    protected Latin1Str requireText(C column) {
        var value = requireField(column).asText();
        if (value == null) throw mismatch(column, "TEXT");
        return value;
    }

    // ========== OPTIONAL COLUMNS ==========

    protected Integer optInt(C column) {
        var field = optField(column);
        return field == null ? null : field.asInteger();
    }

    protected Latin1Str optText(C column) {
        var field = optField(column);
        return field == null ? null : field.asText();
    }

    private Field requireField(C column) {
        int index = table.getColumns().require(column);
        var field = inner.fieldAt(index);
        if (field == null)
            throw new IllegalStateException("Row of '" + table.getName() + "' has no field at index " + index
                    + " for column '" + column.getColumnName() + "'");
        return field;
    }

    private Field optField(C column) {
        int index = table.getColumns().indexOf(column);
        if (index == ColumnMap.ABSENT) return null;
        return inner.fieldAt(index);
    }

    private IllegalStateException mismatch(C column, String expected) {
        return new IllegalStateException("Column '" + table.getName() + "::" + column.getColumnName()
                + "' is " + requireField(column).getTypeCode() + ", expected " + expected);
    }

    @Override
    public String toString() {
        return structName() + toMap();
    }
}
