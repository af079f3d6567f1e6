package com.fdb.tables;

import com.fdb.columns.ItemSetSkillsColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;

import java.util.List;

public final class ItemSetSkillsRow extends TypedRow<ItemSetSkillsColumn, ItemSetSkillsRow> {
    private static final List<RowField<ItemSetSkillsRow>> FIELDS = List.of(
            RowField.of("SkillSetID", ItemSetSkillsRow::getSkillSetId),
            RowField.of("SkillID", ItemSetSkillsRow::getSkillId),
            RowField.of("SkillCastType", ItemSetSkillsRow::getSkillCastType));

    ItemSetSkillsRow(Row inner, ItemSetSkillsTable table) {
        super(inner, table);
    }

    public int getSkillSetId() {
        return requireInt(ItemSetSkillsColumn.SKILL_SET_ID);
    }

    public int getSkillId() {
        return requireInt(ItemSetSkillsColumn.SKILL_ID);
    }

    public Integer getSkillCastType() {
        return optInt(ItemSetSkillsColumn.SKILL_CAST_TYPE);
    }

    @Override
    public String structName() {
        return "ItemSetSkills";
    }

    @Override
    protected List<RowField<ItemSetSkillsRow>> rowFields() {
        return FIELDS;
    }
}
