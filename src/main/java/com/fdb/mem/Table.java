package com.fdb.mem;

import java.util.Iterator;
import java.util.List;

/**
 * A read-only table whose rows are partitioned into a fixed number of buckets.
 * <p>
 * Bucket membership is decided once, when the store is built, from each row's primary key
 * (the first column). Row order within a bucket is stable across reads.
 */
public interface Table {

    String name();

    /**
     * @return the column names in declared order
     */
    List<String> columnNames();

    int bucketCount();

    /**
     * @return the bucket at {@code index}, or null if there is none
     */
    Bucket bucketAt(int index);

    /**
     * Select the bucket for a hash value. The hash is interpreted as an unsigned 32-bit number.
     * @return the bucket, or null if the table has no buckets
     */
    default Bucket bucketForHash(int hash) {
        int count = bucketCount();
        if (count <= 0) return null;
        return bucketAt((int) (Integer.toUnsignedLong(hash) % count));
    }

    /**
     * Iterate all rows, bucket by bucket, in stored order.
     */
    default Iterator<Row> rowIterator() {
        return new TableRowIterator(this);
    }
}
