package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code BehaviorParameter} table.
 */
@Getter
public enum BehaviorParameterColumn implements Column {
    BEHAVIOR_ID("behaviorID", true),
    PARAMETER_ID("parameterID", true),
    VALUE("value", true);

    public static final String TABLE_NAME = "BehaviorParameter";

    private final String columnName;
    private final boolean required;

    BehaviorParameterColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
