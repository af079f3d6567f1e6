package com.fdb.tables;

import com.fdb.columns.MissionsColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;

import java.util.List;

/**
 * One row of the {@code Missions} table. Serialized as {@code Mission}.
 */
public final class MissionsRow extends TypedRow<MissionsColumn, MissionsRow> {
    private static final List<RowField<MissionsRow>> FIELDS = List.of(
            RowField.of("id", MissionsRow::getId),
            RowField.of("defined_type", MissionsRow::getDefinedType),
            RowField.of("defined_subtype", MissionsRow::getDefinedSubtype),
            RowField.of("isMission", MissionsRow::isMission),
            RowField.of("UISortOrder", MissionsRow::getUiSortOrder),
            RowField.of("missionIconID", MissionsRow::getMissionIconId));

    MissionsRow(Row inner, MissionsTable table) {
        super(inner, table);
    }

    public int getId() {
        return requireInt(MissionsColumn.ID);
    }

    public Latin1Str getDefinedType() {
        return optText(MissionsColumn.DEFINED_TYPE);
    }

    public Latin1Str getDefinedSubtype() {
        return optText(MissionsColumn.DEFINED_SUBTYPE);
    }

    public boolean isMission() {
        return requireBool(MissionsColumn.IS_MISSION);
    }

    public Integer getUiSortOrder() {
        return optInt(MissionsColumn.UI_SORT_ORDER);
    }

    public Integer getMissionIconId() {
        return optInt(MissionsColumn.MISSION_ICON_ID);
    }

    @Override
    public String structName() {
        return "Mission";
    }

    @Override
    protected List<RowField<MissionsRow>> rowFields() {
        return FIELDS;
    }
}
