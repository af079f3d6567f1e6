package com.fdb.types;

/**
 * Variants a {@link Field} can hold.
 */
public enum TypeCode {
    NOTHING,
    INTEGER,
    FLOAT,
    TEXT,
    BOOLEAN,
    BIGINT
}
