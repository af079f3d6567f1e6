package com.fdb.tables;

import com.fdb.columns.BehaviorTemplateColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;

import java.util.List;

public final class BehaviorTemplateRow extends TypedRow<BehaviorTemplateColumn, BehaviorTemplateRow> {
    private static final List<RowField<BehaviorTemplateRow>> FIELDS = List.of(
            RowField.of("behaviorID", BehaviorTemplateRow::getBehaviorId),
            RowField.of("templateID", BehaviorTemplateRow::getTemplateId),
            RowField.of("effectID", BehaviorTemplateRow::getEffectId),
            RowField.of("effectHandle", BehaviorTemplateRow::getEffectHandle));

    BehaviorTemplateRow(Row inner, BehaviorTemplateTable table) {
        super(inner, table);
    }

    public int getBehaviorId() {
        return requireInt(BehaviorTemplateColumn.BEHAVIOR_ID);
    }

    public int getTemplateId() {
        return requireInt(BehaviorTemplateColumn.TEMPLATE_ID);
    }

    /**
     * @return the effect id, or null
     */
    public Integer getEffectId() {
        return optInt(BehaviorTemplateColumn.EFFECT_ID);
    }

    /**
     * @return the effect handle, or null
     */
    public Latin1Str getEffectHandle() {
        return optText(BehaviorTemplateColumn.EFFECT_HANDLE);
    }

    @Override
    public String structName() {
        return "BehaviorTemplate";
    }

    @Override
    protected List<RowField<BehaviorTemplateRow>> rowFields() {
        return FIELDS;
    }
}
