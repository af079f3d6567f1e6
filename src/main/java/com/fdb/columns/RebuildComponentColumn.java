package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code RebuildComponent} table.
 */
@Getter
public enum RebuildComponentColumn implements Column {
    ID("id", true),
    RESET_TIME("reset_time", false),
    COMPLETE_TIME("complete_time", false),
    TAKE_IMAGINATION("take_imagination", false),
    INTERRUPTIBLE("interruptible", false),
    SELF_ACTIVATOR("self_activator", false),
    CUSTOM_MODULES("custom_modules", false),
    ACTIVITY_ID("activityID", false),
    POST_IMAGINATION_COST("post_imagination_cost", false),
    TIME_BEFORE_SMASH("time_before_smash", false);

    public static final String TABLE_NAME = "RebuildComponent";

    private final String columnName;
    private final boolean required;

    RebuildComponentColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
