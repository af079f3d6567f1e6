package com.fdb.mem;

import com.fdb.types.Field;
import com.fdb.types.Latin1Str;
import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, fully resident store held on the heap.
 * <p>
 * All text of all tables lives in one shared Latin-1 arena; text fields are views into it.
 * Rows are placed into bucket {@code unsigned(id) % bucketCount}, where {@code id} is the integer
 * in the first column, in the order they were added.
 * <p>
 * Usage:
 * <pre>
 *   var tables = HeapTables.builder()
 *       .table("Icons", 16, "IconID", "IconPath", "IconName")
 *       .row(1, "textures/ui/icon_1.dds", "first")
 *       .row(2, null, "second")            // null to NOTHING
 *       .table("Missions", 64, "id", "isMission", "missionIconID")
 *       .row(100, true, 7)
 *       .build();
 * </pre>
 */
public final class HeapTables implements Tables {
    private static final Logger log = LoggerFactory.getLogger(HeapTables.class);

    private final Map<String, HeapTable> tables;

    private HeapTables(Map<String, HeapTable> tables) {
        this.tables = tables;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Table byName(String name) {
        return tables.get(name);
    }

    @Override
    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }

    @Value
    static class HeapTable implements Table {
        String name;
        List<String> columnNames;
        List<HeapBucket> buckets;

        @Override
        public String name() { return name; }

        @Override
        public List<String> columnNames() { return columnNames; }

        @Override
        public int bucketCount() { return buckets.size(); }

        @Override
        public Bucket bucketAt(int index) {
            if (index < 0 || index >= buckets.size()) return null;
            return buckets.get(index);
        }
    }

    @Value
    static class HeapBucket implements Bucket {
        List<Row> rows;

        @Override
        public List<Row> rows() { return rows; }
    }

    @Value
    static class HeapRow implements Row {
        List<Field> fields;

        @Override
        public Field fieldAt(int index) {
            if (index < 0 || index >= fields.size()) return null;
            return fields.get(index);
        }

        @Override
        public List<Field> fields() { return fields; }
    }

    /**
     * Placeholder for text whose arena bytes are only final once the builder completes.
     */
    @Value
    private static class PendingText {
        int offset;
        int length;
    }

    private static final class TableSpec {
        final String name;
        final int bucketCount;
        final List<String> columns;
        final List<Object[]> rows = new ArrayList<>();

        TableSpec(String name, int bucketCount, List<String> columns) {
            this.name = name;
            this.bucketCount = bucketCount;
            this.columns = columns;
        }
    }

    /**
     * Collects tables and rows, then lays them out into buckets.
     */
    public static final class Builder {
        private final Map<String, TableSpec> specs = new LinkedHashMap<>();
        private final ByteArrayList arena = new ByteArrayList();
        private TableSpec current;

        private Builder() {}

        /**
         * Start a new table. Subsequent {@link #row(Object...)} calls add rows to it.
         */
        public Builder table(String name, int bucketCount, String... columns) {
            Objects.requireNonNull(name, "Table name cannot be null");
            if (bucketCount < 0)
                throw new IllegalArgumentException("Bucket count must not be negative, got: " + bucketCount);
            if (columns.length == 0)
                throw new IllegalArgumentException("Table '" + name + "' needs at least one column");
            if (specs.containsKey(name))
                throw new IllegalArgumentException("Duplicate table: " + name);
            current = new TableSpec(name, bucketCount, List.of(columns));
            specs.put(name, current);
            return this;
        }

        /**
         * Add a row to the current table. Accepted values are {@link Integer}, {@link Float}, {@link Boolean},
         * {@link String} (stored as Latin-1), {@link Long}, {@link Field} and null.
         */
        public Builder row(Object... values) {
            if (current == null)
                throw new IllegalStateException("row() called before table()");
            if (values.length != current.columns.size())
                throw new IllegalArgumentException("Table '" + current.name + "' has " + current.columns.size()
                        + " columns, row has " + values.length);
            if (!(values[0] instanceof Integer))
                throw new IllegalArgumentException("Table '" + current.name + "' needs an integer primary key, got: "
                        + values[0]);
            if (current.bucketCount == 0)
                throw new IllegalArgumentException("Table '" + current.name + "' has no buckets to hold rows");

            var stored = Arrays.copyOf(values, values.length);
            for (int i = 0; i < stored.length; i++) {
                var value = stored[i];
                if (value instanceof String) {
                    stored[i] = appendText((String) value);
                } else if (!isSupported(value)) {
                    throw new IllegalArgumentException("Unsupported value for column '" + current.columns.get(i)
                            + "' of table '" + current.name + "': " + value.getClass().getName());
                }
            }
            current.rows.add(stored);
            return this;
        }

        public HeapTables build() {
            var text = arena.toByteArray();
            var tables = new LinkedHashMap<String, HeapTable>();
            for (var spec : specs.values()) {
                tables.put(spec.name, layout(spec, text));
            }
            log.debug("Built heap store with {} tables and {} bytes of text", tables.size(), text.length);
            return new HeapTables(Collections.unmodifiableMap(tables));
        }

        private PendingText appendText(String value) {
            var bytes = value.getBytes(StandardCharsets.ISO_8859_1);
            int offset = arena.size();
            arena.addElements(offset, bytes);
            return new PendingText(offset, bytes.length);
        }

        private static boolean isSupported(Object value) {
            return value == null || value instanceof Field || value instanceof Integer || value instanceof Float
                    || value instanceof Boolean || value instanceof Long || value instanceof Latin1Str;
        }

        private static HeapTable layout(TableSpec spec, byte[] text) {
            var bucketRows = new ArrayList<List<Row>>(spec.bucketCount);
            for (int i = 0; i < spec.bucketCount; i++) {
                bucketRows.add(new ArrayList<>());
            }
            for (var values : spec.rows) {
                var fields = new ArrayList<Field>(values.length);
                for (var value : values) {
                    fields.add(toField(value, text));
                }
                int key = (Integer) values[0];
                int index = (int) (Integer.toUnsignedLong(key) % spec.bucketCount);
                bucketRows.get(index).add(new HeapRow(Collections.unmodifiableList(fields)));
            }
            var buckets = new ArrayList<HeapBucket>(spec.bucketCount);
            for (var rows : bucketRows) {
                buckets.add(new HeapBucket(Collections.unmodifiableList(rows)));
            }
            return new HeapTable(spec.name, spec.columns, Collections.unmodifiableList(buckets));
        }

        private static Field toField(Object value, byte[] text) {
            if (value == null) return Field.nothing();
            if (value instanceof Field) return (Field) value;
            if (value instanceof Integer) return Field.fromInteger((Integer) value);
            if (value instanceof Float) return Field.fromFloat((Float) value);
            if (value instanceof Boolean) return Field.fromBoolean((Boolean) value);
            if (value instanceof Long) return Field.fromBigInt((Long) value);
            if (value instanceof Latin1Str) return Field.fromText((Latin1Str) value);
            if (value instanceof PendingText) {
                var pending = (PendingText) value;
                return Field.fromText(Latin1Str.wrap(text, pending.getOffset(), pending.getLength()));
            }
            throw new IllegalStateException("Unsupported field value: " + value.getClass().getName());
        }
    }
}
