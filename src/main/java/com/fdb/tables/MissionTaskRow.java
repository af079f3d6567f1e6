package com.fdb.tables;

import com.fdb.columns.MissionTasksColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;

import java.util.List;

/**
 * One row of the {@code MissionTasks} table. Serialized as {@code MissionTask}.
 * Optional accessors return null when the column is absent or holds no value.
 */
public final class MissionTaskRow extends TypedRow<MissionTasksColumn, MissionTaskRow> {
    private static final List<RowField<MissionTaskRow>> FIELDS = List.of(
            RowField.of("id", MissionTaskRow::getId),
            RowField.of("locStatus", MissionTaskRow::getLocStatus),
            RowField.of("taskType", MissionTaskRow::getTaskType),
            RowField.of("target", MissionTaskRow::getTarget),
            RowField.of("targetGroup", MissionTaskRow::getTargetGroup),
            RowField.of("targetValue", MissionTaskRow::getTargetValue),
            RowField.of("taskParam1", MissionTaskRow::getTaskParam1),
            RowField.of("largeTaskIcon", MissionTaskRow::getLargeTaskIcon),
            RowField.of("IconID", MissionTaskRow::getIconId),
            RowField.of("uid", MissionTaskRow::getUid),
            RowField.of("largeTaskIconID", MissionTaskRow::getLargeTaskIconId),
            RowField.of("localize", MissionTaskRow::isLocalize),
            RowField.of("gate_version", MissionTaskRow::getGateVersion));

    MissionTaskRow(Row inner, MissionTasksTable table) {
        super(inner, table);
    }

    public int getId() {
        return requireInt(MissionTasksColumn.ID);
    }

    public int getLocStatus() {
        return requireInt(MissionTasksColumn.LOC_STATUS);
    }

    public int getTaskType() {
        return requireInt(MissionTasksColumn.TASK_TYPE);
    }

    public Integer getTarget() {
        return optInt(MissionTasksColumn.TARGET);
    }

    public Latin1Str getTargetGroup() {
        return optText(MissionTasksColumn.TARGET_GROUP);
    }

    public Integer getTargetValue() {
        return optInt(MissionTasksColumn.TARGET_VALUE);
    }

    public Latin1Str getTaskParam1() {
        return optText(MissionTasksColumn.TASK_PARAM1);
    }

    public Latin1Str getLargeTaskIcon() {
        return optText(MissionTasksColumn.LARGE_TASK_ICON);
    }

    public Integer getIconId() {
        return optInt(MissionTasksColumn.ICON_ID);
    }

    public int getUid() {
        return requireInt(MissionTasksColumn.UID);
    }

    public Integer getLargeTaskIconId() {
        return optInt(MissionTasksColumn.LARGE_TASK_ICON_ID);
    }

    public boolean isLocalize() {
        return requireBool(MissionTasksColumn.LOCALIZE);
    }

    public Latin1Str getGateVersion() {
        return optText(MissionTasksColumn.GATE_VERSION);
    }

    @Override
    public String structName() {
        return "MissionTask";
    }

    @Override
    protected List<RowField<MissionTaskRow>> rowFields() {
        return FIELDS;
    }
}
