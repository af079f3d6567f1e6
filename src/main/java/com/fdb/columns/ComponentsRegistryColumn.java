package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code ComponentsRegistry} table.
 */
@Getter
public enum ComponentsRegistryColumn implements Column {
    ID("id", true),
    COMPONENT_TYPE("component_type", true),
    COMPONENT_ID("component_id", true);

    public static final String TABLE_NAME = "ComponentsRegistry";

    private final String columnName;
    private final boolean required;

    ComponentsRegistryColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
