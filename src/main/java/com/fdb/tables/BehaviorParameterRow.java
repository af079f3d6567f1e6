package com.fdb.tables;

import com.fdb.columns.BehaviorParameterColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;

import java.util.List;

public final class BehaviorParameterRow extends TypedRow<BehaviorParameterColumn, BehaviorParameterRow> {
    private static final List<RowField<BehaviorParameterRow>> FIELDS = List.of(
            RowField.of("behaviorID", BehaviorParameterRow::getBehaviorId),
            RowField.of("parameterID", BehaviorParameterRow::getParameterId),
            RowField.of("value", BehaviorParameterRow::getValue));

    BehaviorParameterRow(Row inner, BehaviorParameterTable table) {
        super(inner, table);
    }

    public int getBehaviorId() {
        return requireInt(BehaviorParameterColumn.BEHAVIOR_ID);
    }

    public Latin1Str getParameterId() {
        return requireText(BehaviorParameterColumn.PARAMETER_ID);
    }

    public float getValue() {
        return requireFloat(BehaviorParameterColumn.VALUE);
    }

    @Override
    public String structName() {
        return "BehaviorParameter";
    }

    @Override
    protected List<RowField<BehaviorParameterRow>> rowFields() {
        return FIELDS;
    }
}
