package com.fdb.error;

/**
 * Types of errors that can occur when binding typed tables to an FDB store or rendering rows as JSON.
 */
public enum ErrorType {
    TABLE_NOT_FOUND,
    COLUMN_NOT_FOUND,
    SERIALIZATION_ERROR
}
