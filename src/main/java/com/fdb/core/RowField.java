package com.fdb.core;

import lombok.Value;

import java.util.function.Function;

/**
 * One entry of a row kind's serialized form: the human-readable field name and how to read it.
 */
@Value
public class RowField<R> {
    String name;
    Function<R, ?> accessor;

    public static <R> RowField<R> of(String name, Function<R, ?> accessor) {
        return new RowField<>(name, accessor);
    }

    public Object read(R row) {
        return accessor.apply(row);
    }
}
