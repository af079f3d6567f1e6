package com.fdb.mem;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator that walks a table's buckets lazily, one bucket at a time.
 */
final class TableRowIterator implements Iterator<Row> {
    private final Table table;
    private final int bucketCount;
    private int nextBucket;
    private Iterator<Row> current = Collections.emptyIterator();

    TableRowIterator(Table table) {
        this.table = table;
        this.bucketCount = table.bucketCount();
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (nextBucket >= bucketCount) return false;
            var bucket = table.bucketAt(nextBucket++);
            // A missing bucket is treated as empty
            current = bucket == null ? Collections.emptyIterator() : bucket.rows().iterator();
        }
        return true;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }
}
