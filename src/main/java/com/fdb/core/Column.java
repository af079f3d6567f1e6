package com.fdb.core;

/**
 * A well-known column of one table kind, identified by name rather than by position.
 * Implemented by one enum per table kind.
 */
public interface Column {

    /**
     * @return the column's name in the store's schema
     */
    String getColumnName();

    /**
     * @return whether a typed table for this kind can be built without the column
     */
    boolean isRequired();
}
