package com.fdb.core;

import com.fdb.mem.Bucket;
import com.fdb.mem.Row;
import com.fdb.mem.Table;
import lombok.experimental.UtilityClass;

/**
 * The hashed lookup protocol shared by all point queries.
 * <p>
 * A signed key is reinterpreted as an unsigned 32-bit value (the bit image is kept, so {@code -1} becomes
 * {@code 0xFFFFFFFF}) and reduced modulo the table's bucket count. Rows of that bucket are then compared
 * against the original signed key by exact equality on the integer variant.
 * <p>
 * Which of several matching rows a query returns is deliberately left to the call site.
 */
@UtilityClass
public class Lookups {

    /**
     * @return the bucket index for {@code key}, or -1 if the table has no buckets
     */
    public static int bucketIndex(int key, int bucketCount) {
        if (bucketCount <= 0) return -1;
        return (int) (Integer.toUnsignedLong(key) % bucketCount);
    }

    /**
     * @return the bucket {@code key} hashes to, or null if there is none
     */
    public static Bucket bucketFor(Table table, int key) {
        return table.bucketForHash(key);
    }

    /**
     * Same bucket as {@link #bucketFor(Table, int)}, addressed by index through {@link Table#bucketAt(int)}.
     */
    public static Bucket bucketAt(Table table, int key) {
        int index = bucketIndex(key, table.bucketCount());
        if (index < 0) return null;
        return table.bucketAt(index);
    }

    /**
     * @return whether the field at {@code keyCol} is the integer {@code key}
     */
    public static boolean keyMatches(Row row, int keyCol, int key) {
        var field = row.fieldAt(keyCol);
        if (field == null) return false;
        var value = field.asInteger();
        return value != null && value == key;
    }

    /**
     * Find the first row of the bucket selected by {@code hashKey} whose column {@code keyCol} equals {@code key}.
     * <p>
     * The bucket is chosen by one key and the comparison is made against another. This only finds rows that
     * physically live in the bucket implied by {@code hashKey}; the caller must pass a hash key consistent with
     * how the table's buckets were built.
     *
     * @return the matching row, or null
     */
    static Row findFirst(Table table, int hashKey, int key, int keyCol) {
        var bucket = bucketFor(table, hashKey);
        if (bucket == null) return null;
        for (var row : bucket.rows()) {
            if (keyMatches(row, keyCol, key)) {
                return row;
            }
        }
        return null;
    }
}
