package com.fdb.core;

import com.fdb.mem.Row;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Iterator over typed rows, wrapping each raw row as it is reached.
 */
public final class RowIter<R> implements Iterator<R> {
    private final Iterator<Row> inner;
    private final Function<Row, R> wrap;

    public RowIter(Iterator<Row> inner, Function<Row, R> wrap) {
        this.inner = inner;
        this.wrap = wrap;
    }

    @Override
    public boolean hasNext() {
        return inner.hasNext();
    }

    @Override
    public R next() {
        if (!inner.hasNext()) {
            throw new NoSuchElementException();
        }
        return wrap.apply(inner.next());
    }
}
