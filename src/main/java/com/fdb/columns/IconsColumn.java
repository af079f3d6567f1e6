package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code Icons} table.
 */
@Getter
public enum IconsColumn implements Column {
    ICON_ID("IconID", true),
    ICON_PATH("IconPath", false),
    ICON_NAME("IconName", false);

    public static final String TABLE_NAME = "Icons";

    private final String columnName;
    private final boolean required;

    IconsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
