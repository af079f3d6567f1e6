package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code BehaviorTemplate} table.
 */
@Getter
public enum BehaviorTemplateColumn implements Column {
    BEHAVIOR_ID("behaviorID", true),
    TEMPLATE_ID("templateID", true),
    EFFECT_ID("effectID", false),
    EFFECT_HANDLE("effectHandle", false);

    public static final String TABLE_NAME = "BehaviorTemplate";

    private final String columnName;
    private final boolean required;

    BehaviorTemplateColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
