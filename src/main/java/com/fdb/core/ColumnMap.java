package com.fdb.core;

import com.fdb.error.ErrorType;
import com.fdb.error.FdbException;
import com.fdb.mem.Table;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Resolution of a table kind's well-known columns to the physical column indices of one table.
 * <p>
 * Columns are matched by name, so tables with extra or reordered columns are accepted as long as every
 * required column is present. Absent optional columns resolve to {@link #ABSENT}.
 * <p>
 * Setting the system property {@code fdb.columns.strict} to {@code true} rejects absent optional columns too.
 */
@ToString(of = {"tableName", "columnType"})
public final class ColumnMap<C extends Enum<C> & Column> {
    private static final Logger log = LoggerFactory.getLogger(ColumnMap.class);

    private static final boolean STRICT = Boolean.parseBoolean(
            System.getProperty("fdb.columns.strict", "false"));

    public static final int ABSENT = -1;

    @Getter
    private final String tableName;
    @Getter
    private final Class<C> columnType;
    private final int[] indices;

    private ColumnMap(String tableName, Class<C> columnType, int[] indices) {
        this.tableName = tableName;
        this.columnType = columnType;
        this.indices = indices;
    }

    public static <C extends Enum<C> & Column> ColumnMap<C> resolve(Table table, Class<C> columnType) throws FdbException {
        return resolve(table, columnType, STRICT);
    }

    static <C extends Enum<C> & Column> ColumnMap<C> resolve(Table table, Class<C> columnType, boolean strict)
            throws FdbException {
        var names = table.columnNames();
        var byName = new Object2IntOpenHashMap<String>(names.size());
        byName.defaultReturnValue(ABSENT);
        for (int i = 0; i < names.size(); i++) {
            // First occurrence wins for duplicated names
            byName.putIfAbsent(names.get(i), i);
        }

        var columns = columnType.getEnumConstants();
        var indices = new int[columns.length];
        Arrays.fill(indices, ABSENT);
        for (var column : columns) {
            int index = byName.getInt(column.getColumnName());
            if (index == ABSENT) {
                if (column.isRequired() || strict) {
                    throw new FdbException(ErrorType.COLUMN_NOT_FOUND,
                            "Table '" + table.name() + "' is missing " + (column.isRequired() ? "required" : "optional")
                                    + " column '" + column.getColumnName() + "'");
                }
                log.debug("Optional column '{}' not present in table '{}'", column.getColumnName(), table.name());
            }
            indices[column.ordinal()] = index;
        }
        return new ColumnMap<>(table.name(), columnType, indices);
    }

    /**
     * @return the physical index of the column, or {@link #ABSENT}
     */
    public int indexOf(C column) {
        return indices[column.ordinal()];
    }

    public OptionalInt get(C column) {
        int index = indices[column.ordinal()];
        return index == ABSENT ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean isPresent(C column) {
        return indices[column.ordinal()] != ABSENT;
    }

    /**
     * Get the index of a column the caller relies on being present.
     * @throws IllegalStateException if the column did not resolve
     */
    public int require(C column) {
        int index = indices[column.ordinal()];
        if (index == ABSENT)
            throw new IllegalStateException("Missing column '" + tableName + "::" + column.getColumnName() + "'");
        return index;
    }
}
