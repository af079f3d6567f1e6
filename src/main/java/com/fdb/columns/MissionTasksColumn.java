package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code MissionTasks} table.
 */
@Getter
public enum MissionTasksColumn implements Column {
    ID("id", true),
    LOC_STATUS("locStatus", true),
    TASK_TYPE("taskType", true),
    TARGET("target", false),
    TARGET_GROUP("targetGroup", false),
    TARGET_VALUE("targetValue", false),
    TASK_PARAM1("taskParam1", false),
    LARGE_TASK_ICON("largeTaskIcon", false),
    ICON_ID("IconID", false),
    UID("uid", true),
    LARGE_TASK_ICON_ID("largeTaskIconID", false),
    LOCALIZE("localize", true),
    GATE_VERSION("gate_version", false);

    public static final String TABLE_NAME = "MissionTasks";

    private final String columnName;
    private final boolean required;

    MissionTasksColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
